package com.numlog.tools;

import com.numlog.common.NumlogConfig;
import com.numlog.protocol.LineProtocol;
import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TCP load generator. Opens short-lived connections to a running server, each sending one
 * random 9-digit number, and measures round-trip latency (connect → server close).
 *
 * Usage:
 *   java -jar numlog-tools.jar [config-path] [connections] [concurrency]
 *
 * With concurrency above the server's connection limit, expect some busy rejections.
 */
public final class LoadGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    // Configurable
    private static int CONNECTIONS = 10_000;
    private static int CONCURRENCY = 4;

    private static final long LOW  = 100_000_000L;   // smallest 9-digit number
    private static final long HIGH = 1_000_000_000L;

    private final String host;
    private final int port;

    private final AtomicLong echoed   = new AtomicLong();
    private final AtomicLong busy     = new AtomicLong();
    private final AtomicLong errors   = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final Histogram  rttHist  = new Histogram(10_000_000_000L, 3);

    public LoadGenerator(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : null;
        if (args.length > 1) CONNECTIONS = Integer.parseInt(args[1]);
        if (args.length > 2) CONCURRENCY = Integer.parseInt(args[2]);

        NumlogConfig cfg = NumlogConfig.load(configPath);
        new LoadGenerator(cfg.host, cfg.port).run(CONNECTIONS, CONCURRENCY);
    }

    public void run(int connections, int concurrency) throws InterruptedException {
        log.info("Sending {} connections to {}:{} with concurrency {}", connections, host, port, concurrency);

        ExecutorService pool = Executors.newFixedThreadPool(concurrency);
        long start = System.nanoTime();
        for (int i = 0; i < connections; i++) {
            pool.execute(this::sendOne);
        }
        pool.shutdown();
        if (!pool.awaitTermination(10, TimeUnit.MINUTES)) {
            log.warn("Load run did not finish within 10 minutes");
            pool.shutdownNow();
        }
        printStats(connections, System.nanoTime() - start);
    }

    private void sendOne() {
        long number = ThreadLocalRandom.current().nextLong(LOW, HIGH);
        String request = LineProtocol.echo(number);

        long sentAt = System.nanoTime();
        try (Socket socket = new Socket(host, port)) {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(10_000);
            OutputStream out = socket.getOutputStream();
            InputStream  in  = socket.getInputStream();

            out.write(request.getBytes(LineProtocol.CHARSET));
            out.flush();
            String response = readToEnd(in);
            synchronized (rttHist) {
                rttHist.recordValue(System.nanoTime() - sentAt);
            }
            classify(request, response);
        } catch (IOException e) {
            // a busy server may reset the connection before our write lands
            failures.incrementAndGet();
            log.debug("Connection failed: {}", e.getMessage());
        }
    }

    private void classify(String request, String response) {
        if (response.equals(request)) {
            echoed.incrementAndGet();
        } else if (response.equals(LineProtocol.BUSY_MESSAGE)) {
            busy.incrementAndGet();
        } else {
            errors.incrementAndGet();
            log.warn("Unexpected response: {}", response.trim());
        }
    }

    private void printStats(long sent, long elapsedNanos) {
        System.out.printf("%n=== Load Generator Results ===%n");
        System.out.printf("Connections: %d in %.1f s%n", sent, elapsedNanos / 1e9);
        System.out.printf("Echoed:      %d (%.1f%%)%n", echoed.get(), 100.0 * echoed.get() / sent);
        System.out.printf("Busy:        %d%n", busy.get());
        System.out.printf("Errors:      %d%n", errors.get());
        System.out.printf("Failures:    %d%n", failures.get());
        System.out.printf("RTT p50:     %.1f µs%n", rttHist.getValueAtPercentile(50) / 1_000.0);
        System.out.printf("RTT p99:     %.1f µs%n", rttHist.getValueAtPercentile(99) / 1_000.0);
        System.out.printf("RTT p999:    %.1f µs%n", rttHist.getValueAtPercentile(99.9) / 1_000.0);
        System.out.printf("RTT max:     %.1f µs%n", rttHist.getMaxValue() / 1_000.0);
    }

    private static String readToEnd(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        byte[] chunk = new byte[64];
        int n;
        while ((n = in.read(chunk)) >= 0) {
            buf.write(chunk, 0, n);
        }
        return buf.toString(LineProtocol.CHARSET);
    }

    long echoed() { return echoed.get(); }

    long busy() { return busy.get(); }
}
