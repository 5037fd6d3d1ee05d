package com.vidnyan.conclint.domain.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Well-known names of the coroutine library and its blocking neighbours.
 * Matching is name based; see {@link AnalysisConfig} for host extensions.
 */
public final class CoroutineNames {

    private CoroutineNames() {
    }

    public static final String GLOBAL_SCOPE = "GlobalScope";
    public static final String SCOPE_CONSTRUCTOR = "CoroutineScope";
    public static final String SCOPE_ANNOTATION = "StructuredScope";
    public static final String THIS = "this";

    public static final String LAUNCH = "launch";
    public static final String ASYNC = "async";
    public static final String RUN_BLOCKING = "runBlocking";
    public static final String WITH_CONTEXT = "withContext";
    public static final String COROUTINE_SCOPE = "coroutineScope";
    public static final String SUPERVISOR_SCOPE = "supervisorScope";
    public static final String PRODUCE = "produce";
    public static final String FLOW = "flow";

    /** Calls starting a new concurrently scheduled task on a scope. */
    public static final Set<String> TASK_LAUNCHERS = Set.of(LAUNCH, ASYNC);

    /** Calls whose block argument runs as (or inside) a coroutine. */
    public static final Set<String> COROUTINE_BUILDERS = Set.of(
            LAUNCH, ASYNC, RUN_BLOCKING, WITH_CONTEXT, COROUTINE_SCOPE, SUPERVISOR_SCOPE);

    public static final Set<String> STRUCTURED_BUILDERS = Set.of(COROUTINE_SCOPE, SUPERVISOR_SCOPE);

    /** Calls taking a coroutine context as argument. */
    public static final Set<String> CONTEXT_TAKING_BUILDERS = Set.of(LAUNCH, ASYNC, WITH_CONTEXT);

    public static final String DISPATCHERS = "Dispatchers";
    public static final String UNCONFINED = "Unconfined";
    public static final String MAIN = "Main";
    public static final String NON_CANCELLABLE = "NonCancellable";
    public static final Set<String> JOB_CONSTRUCTORS = Set.of("Job", "SupervisorJob");

    public static final String CANCELLATION_EXCEPTION = "CancellationException";
    public static final Set<String> BROAD_CATCH_TYPES = Set.of(
            "Exception", "Throwable", "java.lang.Exception", "java.lang.Throwable");

    public static final String AWAIT_PREFIX = "await";
    public static final String AWAIT_ALL = "awaitAll";
    public static final String CANCEL = "cancel";
    public static final String ENSURE_ACTIVE = "ensureActive";
    public static final String DELAY = "delay";

    public static final String CHANNEL_CONSTRUCTOR = "Channel";
    public static final String CLOSE = "close";
    public static final String CONSUME_EACH = "consumeEach";

    public static final String LIFECYCLE_SCOPE = "lifecycleScope";
    public static final String VIEW_MODEL_SCOPE = "viewModelScope";
    // direct supertypes only, so the common framework subclasses are listed too
    public static final Set<String> VIEW_MODEL_TYPES = Set.of("ViewModel", "AndroidViewModel");
    public static final Set<String> LIFECYCLE_OWNER_TYPES = Set.of(
            "LifecycleOwner", "ComponentActivity", "FragmentActivity", "AppCompatActivity",
            "Fragment", "DialogFragment");
    public static final Set<String> LIFECYCLE_LAUNCHERS = Set.of(
            LAUNCH, "launchWhenStarted", "launchWhenCreated", "launchWhenResumed");
    public static final Set<String> FLOW_COLLECTORS = Set.of("collect", "collectLatest", "collectIndexed");
    public static final Set<String> LIFECYCLE_SAFE_COLLECTION = Set.of("repeatOnLifecycle", "flowWithLifecycle");

    public static final Set<String> FLOW_BUILDERS = Set.of(FLOW);

    public static final Set<String> DEFAULT_FRAMEWORK_SCOPES = Set.of(VIEW_MODEL_SCOPE, LIFECYCLE_SCOPE);
    public static final Set<String> DEFAULT_FRAMEWORK_SCOPE_FACTORIES = Set.of("rememberCoroutineScope");

    public static final Set<String> DEFAULT_COOPERATION_POINTS = Set.of(
            "yield", ENSURE_ACTIVE, DELAY, "suspendCancellableCoroutine", "withTimeout", "withTimeoutOrNull");

    /** Library functions known to suspend. */
    public static final Set<String> KNOWN_SUSPEND_CALLS = Set.of(
            DELAY, "yield", WITH_CONTEXT, "withTimeout", "withTimeoutOrNull", "await", AWAIT_ALL,
            "join", "joinAll", "cancelAndJoin", "suspendCancellableCoroutine", "suspendCoroutine",
            COROUTINE_SCOPE, SUPERVISOR_SCOPE, "emit", "send", "receive");

    /** Iteration helpers whose lambda runs once per element. */
    public static final Set<String> ITERATION_FUNCTIONS = Set.of(
            "forEach", "onEach", "map", "mapNotNull", "flatMap", "filter", "filterNotNull", "repeat");

    /** Blocking call registry, {@code Type.method} mapped to its category. */
    public static final Map<String, BlockingCategory> DEFAULT_BLOCKING_CALLS = blockingCalls();

    public enum BlockingCategory {
        THREAD("use delay() instead of sleeping the thread"),
        IO("move the stream access into withContext(Dispatchers.IO)"),
        DATABASE("run JDBC work inside withContext(Dispatchers.IO) or use a suspending driver"),
        HTTP("use the suspending client API or withContext(Dispatchers.IO)"),
        SYNCHRONIZATION("use the suspending coroutine primitives (Mutex, Channel, Deferred.await)"),
        CUSTOM("move the call into withContext(Dispatchers.IO)");

        private final String hint;

        BlockingCategory(String hint) {
            this.hint = hint;
        }

        public String hint() {
            return hint;
        }
    }

    private static Map<String, BlockingCategory> blockingCalls() {
        Map<String, BlockingCategory> calls = new LinkedHashMap<>();
        calls.put("Thread.sleep", BlockingCategory.THREAD);
        calls.put("java.lang.Thread.sleep", BlockingCategory.THREAD);
        calls.put("Object.wait", BlockingCategory.THREAD);
        calls.put("java.lang.Object.wait", BlockingCategory.THREAD);

        calls.put("InputStream.read", BlockingCategory.IO);
        calls.put("java.io.InputStream.read", BlockingCategory.IO);
        calls.put("OutputStream.write", BlockingCategory.IO);
        calls.put("java.io.OutputStream.write", BlockingCategory.IO);
        calls.put("Reader.read", BlockingCategory.IO);
        calls.put("java.io.Reader.read", BlockingCategory.IO);
        calls.put("Writer.write", BlockingCategory.IO);
        calls.put("java.io.Writer.write", BlockingCategory.IO);
        calls.put("BufferedReader.readLine", BlockingCategory.IO);
        calls.put("java.io.BufferedReader.readLine", BlockingCategory.IO);
        calls.put("Files.readAllBytes", BlockingCategory.IO);
        calls.put("java.nio.file.Files.readAllBytes", BlockingCategory.IO);
        calls.put("Files.readAllLines", BlockingCategory.IO);
        calls.put("java.nio.file.Files.readAllLines", BlockingCategory.IO);
        calls.put("Files.write", BlockingCategory.IO);
        calls.put("java.nio.file.Files.write", BlockingCategory.IO);

        calls.put("Statement.execute", BlockingCategory.DATABASE);
        calls.put("Statement.executeQuery", BlockingCategory.DATABASE);
        calls.put("Statement.executeUpdate", BlockingCategory.DATABASE);
        calls.put("java.sql.Statement.execute", BlockingCategory.DATABASE);
        calls.put("java.sql.Statement.executeQuery", BlockingCategory.DATABASE);
        calls.put("java.sql.Statement.executeUpdate", BlockingCategory.DATABASE);
        calls.put("PreparedStatement.execute", BlockingCategory.DATABASE);
        calls.put("PreparedStatement.executeQuery", BlockingCategory.DATABASE);
        calls.put("PreparedStatement.executeUpdate", BlockingCategory.DATABASE);
        calls.put("Connection.prepareStatement", BlockingCategory.DATABASE);
        calls.put("java.sql.Connection.prepareStatement", BlockingCategory.DATABASE);
        calls.put("ResultSet.next", BlockingCategory.DATABASE);
        calls.put("java.sql.ResultSet.next", BlockingCategory.DATABASE);

        calls.put("Call.execute", BlockingCategory.HTTP);
        calls.put("okhttp3.Call.execute", BlockingCategory.HTTP);
        calls.put("retrofit2.Call.execute", BlockingCategory.HTTP);

        calls.put("BlockingQueue.take", BlockingCategory.SYNCHRONIZATION);
        calls.put("BlockingQueue.put", BlockingCategory.SYNCHRONIZATION);
        calls.put("java.util.concurrent.BlockingQueue.take", BlockingCategory.SYNCHRONIZATION);
        calls.put("java.util.concurrent.BlockingQueue.put", BlockingCategory.SYNCHRONIZATION);
        calls.put("CountDownLatch.await", BlockingCategory.SYNCHRONIZATION);
        calls.put("java.util.concurrent.CountDownLatch.await", BlockingCategory.SYNCHRONIZATION);
        calls.put("Semaphore.acquire", BlockingCategory.SYNCHRONIZATION);
        calls.put("java.util.concurrent.Semaphore.acquire", BlockingCategory.SYNCHRONIZATION);
        calls.put("Future.get", BlockingCategory.SYNCHRONIZATION);
        calls.put("java.util.concurrent.Future.get", BlockingCategory.SYNCHRONIZATION);
        return Collections.unmodifiableMap(calls);
    }
}
