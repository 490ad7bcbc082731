package net.spookly.shunt;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import lombok.extern.slf4j.Slf4j;
import net.spookly.shunt.config.ConfigDefaults;
import net.spookly.shunt.config.ConfigLoader;
import net.spookly.shunt.config.ConfigPrinter;
import net.spookly.shunt.config.ConfigWarnings;
import net.spookly.shunt.config.ShuntConfig;
import net.spookly.shunt.proxy.ProxyServer;
import net.spookly.shunt.proxy.StatusBackendProbe;
import net.spookly.shunt.resolve.EndpointResolver;
import net.spookly.shunt.resolve.NettyDnsLookup;
import net.spookly.shunt.routing.ServerSelector;
import net.spookly.shunt.routing.ServerSelectors;
import net.spookly.shunt.status.StatusCache;
import org.slf4j.LoggerFactory;

/**
 * Standalone entry point for the Shunt router process.
 */
@Slf4j
public final class ShuntMain {
    private static final String DEFAULT_CONFIG = "config/shunt.yaml";

    private ShuntMain() {
    }

    /**
     * Load configuration, build the selector and status cache, and run the listener until shutdown.
     */
    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        Path configPath = options.configPath;
        ShuntConfig config = ConfigLoader.load(configPath);
        applyLogLevel(config);
        emitWarnings(config, configPath);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }
        log.info("Shunt config loaded: mode={} listen={}:{}", config.mode,
                config.listen == null || config.listen.host == null ? "0.0.0.0" : config.listen.host,
                config.listen == null || config.listen.port == null
                        ? ConfigDefaults.DEFAULT_LISTEN_PORT
                        : config.listen.port);

        EventLoopGroup workerGroup = new NioEventLoopGroup();
        int timeoutMs = ServerSelectors.timeoutMs(config);
        NettyDnsLookup dnsLookup = new NettyDnsLookup(workerGroup.next(), timeoutMs);
        EndpointResolver resolver = new EndpointResolver(dnsLookup);
        StatusBackendProbe probe = new StatusBackendProbe(workerGroup, resolver);
        ServerSelector selector = ServerSelectors.fromConfig(config, probe);
        StatusCache statusCache = new StatusCache(selector);
        ProxyServer proxyServer = new ProxyServer(config, statusCache, selector, resolver, workerGroup);
        proxyServer.start();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            proxyServer.stop();
            try {
                selector.close();
            } catch (Exception e) {
                log.warn("Failed to close selector: {}", e.getMessage());
            }
            dnsLookup.close();
            workerGroup.shutdownGracefully().syncUninterruptibly();
            latch.countDown();
        }, "shunt-shutdown"));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    static void applyLogLevel(ShuntConfig config) {
        if (config.logging == null || config.logging.level == null) {
            return;
        }
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof Logger) {
            ((Logger) root).setLevel(Level.toLevel(config.logging.level, Level.INFO));
        }
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    private static void emitWarnings(ShuntConfig config, Path configPath) {
        for (String warning : ConfigWarnings.collect(config, configPath)) {
            log.warn("Config warning: {}", warning);
        }
    }

    record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
