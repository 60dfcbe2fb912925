package io.fullerstack.dispatch.bootstrap;

import io.fullerstack.dispatch.clock.Ticker;
import io.fullerstack.dispatch.config.HierarchicalConfig;
import io.fullerstack.dispatch.context.ErrorSink;
import io.fullerstack.dispatch.context.LoopingContext;
import io.fullerstack.dispatch.pool.DispatcherPool;
import io.fullerstack.dispatch.scope.JobScope;
import io.fullerstack.dispatch.scope.ScopeErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Convention-based wiring of one main context, one dispatcher pool and a root scope.
 * <p>
 * Sizes and timeouts come from {@link HierarchicalConfig#forRuntime(String)}; builder
 * settings take precedence over configuration.
 * <p>
 * <strong>Usage:</strong>
 * <pre>
 * try (DispatchRuntime runtime = DispatchRuntime.builder("app").build()) {
 *     JobScope screen = runtime.scope("screen");
 *     screen.launch(signal -&gt; repository.load(), runtime.main(), view::show);
 *     runtime.main().run();   // or runtime.startMain()
 * }
 * </pre>
 * <p>
 * Closing tears down the root scope (and every scope handed out), shuts the pool down
 * gracefully and stops the main context, in that order.
 */
public class DispatchRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DispatchRuntime.class);

    private final String name;
    private final LoopingContext main;
    private final DispatcherPool pool;
    private final JobScope rootScope;
    private final Duration shutdownTimeout;
    private volatile boolean closed = false;

    private DispatchRuntime(Builder builder) {
        HierarchicalConfig config = builder.config != null
            ? builder.config
            : HierarchicalConfig.forRuntime(builder.name);

        int workers = builder.workers != null
            ? builder.workers
            : config.getInt(HierarchicalConfig.POOL_WORKERS);
        int queueCapacity = builder.queueCapacity != null
            ? builder.queueCapacity
            : config.getInt(HierarchicalConfig.POOL_QUEUE_CAPACITY);

        this.name = builder.name;
        this.shutdownTimeout = config.getDuration(HierarchicalConfig.POOL_SHUTDOWN_TIMEOUT_MS);
        this.main = LoopingContext.builder(builder.name + "-main")
            .ticker(builder.ticker)
            .errorSink(builder.errorSink)
            .stopTimeout(config.getDuration(HierarchicalConfig.CONTEXT_STOP_TIMEOUT_MS))
            .build();
        this.pool = DispatcherPool.builder(builder.name)
            .workers(workers)
            .queueCapacity(queueCapacity)
            .build();
        this.rootScope = new JobScope(
            builder.name,
            pool,
            builder.scopeErrorHandler,
            config.getDuration(HierarchicalConfig.SCOPE_TEARDOWN_TIMEOUT_MS)
        );

        logger.info("Dispatch runtime '{}' started ({} worker(s), config {})",
            name, pool.workerCount(), config.context());
    }

    /**
     * Create a builder for a runtime with the given name.
     *
     * @param name Runtime name; also selects dispatch_{name}.properties
     * @return Builder instance
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * @return the main context; run it with {@link LoopingContext#run()} or {@link #startMain()}
     */
    public LoopingContext main() {
        return main;
    }

    public DispatcherPool pool() {
        return pool;
    }

    public JobScope rootScope() {
        return rootScope;
    }

    /**
     * Named child of the root scope, created on first use.
     *
     * @param scopeName Scope name
     * @return the scope
     */
    public JobScope scope(String scopeName) {
        return rootScope.scope(scopeName);
    }

    /**
     * Runs the main context on its own thread.
     *
     * @return the main context
     */
    public LoopingContext startMain() {
        return main.start();
    }

    public String name() {
        return name;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Closing dispatch runtime '{}'", name);
        try {
            rootScope.close();
        } catch (RuntimeException e) {
            logger.error("Root scope teardown failed for runtime '{}'", name, e);
        }
        if (!pool.shutdownGracefully(shutdownTimeout)) {
            logger.warn("Pool of runtime '{}' did not terminate within {}", name, shutdownTimeout);
        }
        main.close();
        logger.info("Dispatch runtime '{}' closed", name);
    }

    /**
     * Builder for customizing runtime wiring.
     */
    public static class Builder {

        private final String name;
        private HierarchicalConfig config;
        private Integer workers;
        private Integer queueCapacity;
        private Ticker ticker = Ticker.system();
        private ErrorSink errorSink = ErrorSink.logging();
        private ScopeErrorHandler scopeErrorHandler = ScopeErrorHandler.cancelSiblings();

        private Builder(String name) {
            Objects.requireNonNull(name, "Runtime name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Runtime name cannot be blank");
            }
            this.name = name;
        }

        /**
         * Use explicit configuration instead of dispatch_{name}.properties.
         */
        public Builder config(HierarchicalConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        /**
         * Override the configured worker count (0 = available processors).
         */
        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        /**
         * Override the configured queue capacity (0 = unbounded).
         */
        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        /**
         * Time source for the main context's delayed posts and timeouts.
         */
        public Builder ticker(Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker);
            return this;
        }

        /**
         * Receives continuation failures on the main context.
         */
        public Builder errorSink(ErrorSink errorSink) {
            this.errorSink = Objects.requireNonNull(errorSink);
            return this;
        }

        /**
         * Receives launch failures of every scope handed out by the runtime.
         */
        public Builder scopeErrorHandler(ScopeErrorHandler scopeErrorHandler) {
            this.scopeErrorHandler = Objects.requireNonNull(scopeErrorHandler);
            return this;
        }

        public DispatchRuntime build() {
            return new DispatchRuntime(this);
        }
    }
}
