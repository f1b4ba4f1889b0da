package davshelf.server.webdav;

import davshelf.server.util.Logging;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers completion notifications to the {@link WebdavDelegate} on a single thread, in the order the mutations
 * completed, so the embedding application never sees two at once.
 */
public class DelegateNotifier {

    private static final Logger LOG = Logging.LOG();

    private final WebdavDelegate delegate;
    private final ExecutorService executor;

    public DelegateNotifier(WebdavDelegate delegate) {
        this.delegate = delegate;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "webdav-notifier");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * The delegate, for authorization hooks that must be answered synchronously.
     */
    public WebdavDelegate hooks() {
        return delegate;
    }

    public void notify(Consumer<WebdavDelegate> event) {
        executor.execute(() -> {
            try {
                event.accept(delegate);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, e, () -> "Delegate notification failed");
            }
        });
    }

    /**
     * Blocks until every notification queued before this call has been delivered.
     */
    public void flush() {
        try {
            executor.submit(() -> {}).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (! executor.awaitTermination(5, TimeUnit.SECONDS))
                LOG.warning("Pending delegate notifications dropped at shutdown");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
