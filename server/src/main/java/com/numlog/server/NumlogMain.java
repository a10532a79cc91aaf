package com.numlog.server;

import com.numlog.common.LatencyStats;
import com.numlog.common.NumlogConfig;
import com.numlog.server.report.OutputReporter;
import com.numlog.server.report.ReporterScheduler;
import com.numlog.server.report.TotalsReporter;
import com.numlog.state.CounterState;
import com.numlog.state.FileUniqueValueLog;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * numlog process entry point.
 *
 * Usage:
 *   java -jar numlog-server.jar [config-path]
 *
 * Runs until SIGINT/SIGTERM, then stops accepting, lets in-flight connections finish
 * (at most connectionLimit of them), emits final reports and exits 0.
 */
public final class NumlogMain {

    private static final Logger log = LoggerFactory.getLogger(NumlogMain.class);

    private final NumlogConfig cfg;
    private final FileUniqueValueLog uniqueLog;
    private final CounterState state;
    private final ReporterScheduler reporters;
    private final NumlogServer server;

    NumlogMain(NumlogConfig cfg, FatalFaultHandler fatal) throws IOException {
        this.cfg       = cfg;
        this.uniqueLog = new FileUniqueValueLog(Paths.get(cfg.uniqueLogPath));
        this.state     = new CounterState(cfg.connectionLimit, uniqueLog);

        LatencyStats latency = new LatencyStats("connection");
        this.reporters = new ReporterScheduler(List.of(
                new OutputReporter(state, Duration.ofSeconds(cfg.outputIntervalSecs), System.out),
                new TotalsReporter(state, Duration.ofSeconds(cfg.logIntervalSecs), latency)));
        this.server = new NumlogServer(cfg, state, latency, fatal);
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : null;

        NumlogMain app;
        try {
            NumlogConfig cfg = NumlogConfig.load(configPath).validate();
            log.info("Starting numlog: {}:{} connectionLimit={} uniqueLog={}",
                    cfg.host, cfg.port, cfg.connectionLimit, cfg.uniqueLogPath);
            app = new NumlogMain(cfg, FatalFaultHandler.halting());
            app.start();
        } catch (Exception e) {
            log.error("Failed to start numlog server", e);
            System.exit(1);
            return;
        }

        new ShutdownSignalBarrier().await();

        // Leading new line since the terminal echoes the interrupt sequence on stdout.
        System.out.printf("%nShutting down server.%n");
        app.shutdown();
        System.exit(0);
    }

    void start() throws InterruptedException {
        reporters.start();
        server.start();

        InetSocketAddress addr = server.localAddress();
        System.out.printf("Started tcp server.%nListening on %s:%d%n",
                addr.getAddress().getHostAddress(), addr.getPort());
    }

    /** Graceful stop. Safe to call once; in-flight connections get shutdownGraceSecs to finish. */
    void shutdown() {
        server.stopAccepting();
        state.close();
        try {
            if (!state.awaitIdle(Duration.ofSeconds(cfg.shutdownGraceSecs))) {
                log.warn("{} connection(s) still open after {}s, closing anyway",
                        state.inFlight(), cfg.shutdownGraceSecs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining connections");
        }
        reporters.stop();
        server.stop();
        try {
            uniqueLog.close();
        } catch (IOException e) {
            log.error("Failed to close unique values log {}", uniqueLog.path(), e);
        }
        log.info("numlog shutdown complete: total={} unique={}", state.total(), state.uniqueCount());
    }

    InetSocketAddress localAddress() {
        return server.localAddress();
    }

    NumlogServer server() {
        return server;
    }

    CounterState state() {
        return state;
    }
}
