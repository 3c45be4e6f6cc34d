package com.askdb.config;

import com.askdb.notify.CompletionNotifier;
import com.askdb.notify.QueryCompletionListener;
import com.askdb.pool.ConnectionPoolManager;
import com.askdb.pool.HikariTenantPoolFactory;
import com.askdb.query.QueryExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the core components that need explicit construction.
 */
@Configuration
public class AskDbConfiguration {

    @Bean
    public AskDbSettings askDbSettings(Environment environment) {
        return AskDbSettings.fromEnvironment(environment);
    }

    /**
     * The pool manager; {@code closeAll} runs on context shutdown so no tenant connection
     * outlives the process.
     */
    @Bean(destroyMethod = "closeAll")
    public ConnectionPoolManager connectionPoolManager(AskDbSettings settings) {
        return new ConnectionPoolManager(new HikariTenantPoolFactory(), settings.pool());
    }

    @Bean
    public QueryExecutor queryExecutor(ConnectionPoolManager connectionPoolManager, AskDbSettings settings) {
        return new QueryExecutor(connectionPoolManager, settings.query());
    }

    @Bean(destroyMethod = "shutdown")
    public CompletionNotifier completionNotifier(List<QueryCompletionListener> listeners) {
        return new CompletionNotifier(listeners);
    }

    /**
     * Threads that drive streamed answers, one per open stream.
     */
    @Bean(name = "askdbStreamExecutor", destroyMethod = "shutdownNow")
    public ExecutorService askdbStreamExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "askdb-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
