package com.syro;

import com.syro.api.Capability;
import com.syro.api.InboundMessage;
import com.syro.core.CommandsSystem;
import com.syro.core.config.ConfigManager;
import com.syro.core.config.ConfigValidator;
import com.syro.core.config.Configuration;
import com.syro.modules.CoreCommandsModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.Set;

public class Main {
    // Logger is created only after the streams are redirected
    private static Logger logger;

    public static void main(String[] args) {
        setupGlobalLogging();

        logger = LoggerFactory.getLogger(Main.class);
        logger.info("🚀 Starting Syro command core...");
        logger.info("📄 Log File: logs/latest.log (and session-*.log)");

        File dataDir = new File(args.length > 0 ? args[0] : "data");

        try {
            Configuration config = new ConfigManager(dataDir).getConfig();
            new ConfigValidator().validateAndReport(config);

            CommandsSystem system = CommandsSystem.create(config);
            system.registerModule(new CoreCommandsModule());
            system.registerMessageSender((origin, text) -> logger.info("💬 -> {}: {}", origin.actorId(), text));
            system.init();

            Runtime.getRuntime().addShutdownHook(new Thread(system::shutdown, "shutdown-hook"));
            startConsoleListener(system);

            logger.info("Service running. Joining main thread.");
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            logger.warn("Main thread interrupted. Exiting...");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("CRITICAL FAILURE during startup", e);
            System.exit(1);
        }
    }

    /**
     * Feeds stdin lines into the dispatcher as direct messages from a local
     * operator holding every capability.
     */
    private static void startConsoleListener(CommandsSystem system) {
        Thread t = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    if (line.isBlank()) continue;
                    InboundMessage message = new InboundMessage(line, "console", List.of(),
                            Set.of(Capability.MODERATE, Capability.ADMINISTER), null, "console");
                    system.executeCommandAsync(message);
                }
            } catch (IOException e) {
                logger.warn("Console listener stopped: {}", e.getMessage());
            }
        }, "console-listener");
        t.setDaemon(true);
        t.start();
    }

    /**
     * Tees System.out and System.err into log files before anything else runs.
     */
    private static void setupGlobalLogging() {
        try {
            File logDir = new File("logs");
            if (!logDir.exists()) logDir.mkdirs();

            String timeStamp = new SimpleDateFormat("yyyy-MM-dd_HH-mm-ss").format(new Date());
            File sessionLog = new File(logDir, "session-" + timeStamp + ".log");
            File latestLog = new File(logDir, "latest.log");

            FileOutputStream sessionStream = new FileOutputStream(sessionLog);
            FileOutputStream latestStream = new FileOutputStream(latestLog); // overwrites latest.log

            // console + session file + latest file
            MultiOutputStream multiOut = new MultiOutputStream(System.out, sessionStream, latestStream);
            MultiOutputStream multiErr = new MultiOutputStream(System.err, sessionStream, latestStream);

            System.setOut(new PrintStream(multiOut, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(multiErr, true, StandardCharsets.UTF_8));

        } catch (Exception e) {
            System.err.println("FATAL: Could not initialise logging: " + e.getMessage());
        }
    }

    // Sends output to several targets
    static class MultiOutputStream extends OutputStream {
        private final OutputStream[] streams;

        public MultiOutputStream(OutputStream... streams) {
            this.streams = streams;
        }

        @Override
        public void write(int b) throws IOException {
            for (OutputStream s : streams) s.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            for (OutputStream s : streams) s.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            for (OutputStream s : streams) s.flush();
        }

        @Override
        public void close() throws IOException {
            for (OutputStream s : streams) s.close();
        }
    }
}
