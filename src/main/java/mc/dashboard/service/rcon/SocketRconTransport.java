package mc.dashboard.service.rcon;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import mc.dashboard.config.DashboardConfig;
import nl.vv32.rcon.Rcon;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link RconTransport} over a blocking socket channel. Reads are bounded by running each exchange on a
 * worker thread and closing the channel when the deadline passes.
 */
@Slf4j
@Component
public class SocketRconTransport implements RconTransport {
    private final DashboardConfig config;
    private final ExecutorService ioExecutor;

    public SocketRconTransport(DashboardConfig config) {
        this.config = config;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("rcon-io-");
        threadFactory.setDaemon(true);
        this.ioExecutor = Executors.newCachedThreadPool(threadFactory);
    }

    @Override
    public RconSession open(RconEndpoint endpoint) throws IOException {
        long connectTimeout = config.getRcon().getConnectTimeout();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(connectTimeout);
        SocketChannel channel = SocketChannel.open();
        try {
            channel.socket().connect(new InetSocketAddress(endpoint.getHost(), endpoint.getPort()), (int) connectTimeout);
            // Minecraft writes section-sign colour codes as UTF-8
            Rcon rcon = Rcon.newBuilder()
                    .withChannel(channel)
                    .withCharset(StandardCharsets.UTF_8)
                    .build();
            SocketRconSession session = new SocketRconSession(endpoint, channel, rcon);

            // connect and authenticate share one deadline
            long authTimeout = Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
            boolean authenticated = session.call(() -> rcon.authenticate(endpoint.getPassword()), authTimeout);
            if (!authenticated) {
                session.close();
                throw new IOException("RCON authentication rejected by " + endpoint.address());
            }
            log.debug("Authenticated RCON session to {}", endpoint.address());
            return session;
        } catch (IOException e) {
            if (channel.isOpen()) {
                try {
                    channel.close();
                } catch (IOException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            throw e;
        }
    }

    @PreDestroy
    public void shutdown() {
        ioExecutor.shutdownNow();
    }

    private final class SocketRconSession implements RconSession {
        private final RconEndpoint endpoint;
        private final SocketChannel channel;
        private final Rcon rcon;
        private final AtomicBoolean closed = new AtomicBoolean();
        private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();

        private SocketRconSession(RconEndpoint endpoint, SocketChannel channel, Rcon rcon) {
            this.endpoint = endpoint;
            this.channel = channel;
            this.rcon = rcon;
        }

        @Override
        public synchronized String send(String command) throws IOException {
            if (!isOpen()) {
                throw new ClosedChannelException();
            }
            return call(() -> rcon.sendCommand(command), config.getRcon().getCommandTimeout());
        }

        <T> T call(Callable<T> exchange, long timeoutMillis) throws IOException {
            Future<T> future = ioExecutor.submit(exchange);
            try {
                return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw fail(new SocketTimeoutException("No RCON reply from " + endpoint.address() + " within " + timeoutMillis + "ms"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw fail(new InterruptedIOException("Interrupted waiting for RCON reply from " + endpoint.address()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                throw fail(cause instanceof IOException ? (IOException) cause : new IOException(cause));
            }
        }

        private IOException fail(IOException failure) {
            log.debug("RCON session to {} failed: {}", endpoint.address(), failure.getMessage());
            try {
                close();
            } catch (IOException closeError) {
                failure.addSuppressed(closeError);
            }
            return failure;
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && channel.isOpen();
        }

        @Override
        public void onClose(Runnable listener) {
            closeListeners.add(listener);
            if (closed.get() && closeListeners.remove(listener)) {
                listener.run();
            }
        }

        @Override
        public void close() throws IOException {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                channel.close();
            } finally {
                for (Runnable listener : closeListeners) {
                    listener.run();
                }
                closeListeners.clear();
            }
        }
    }
}
