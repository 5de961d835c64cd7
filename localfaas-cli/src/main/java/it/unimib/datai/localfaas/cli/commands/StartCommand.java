package it.unimib.datai.localfaas.cli.commands;

import it.unimib.datai.localfaas.emulator.LocalEmulator;
import it.unimib.datai.localfaas.emulator.lifecycle.ExitHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

@Command(name = "start", description = "Keeps the emulator running and serves the invoke API until interrupted.")
public class StartCommand extends EmulatorCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(StartCommand.class);

    @Option(names = {"--invoke-port"}, description = "Invoke API port (env: DOCKER_LAMBDA_API_PORT, default 9002).")
    Integer invokePort;

    @Option(names = {"-w", "--watch"}, description = "Restart the worker when files under the code roots change (env: DOCKER_LAMBDA_WATCH).")
    Boolean watch;

    final CompletableFuture<Integer> exitStatus = new CompletableFuture<>();
    volatile LocalEmulator emulator;

    @Override
    public Integer call() throws Exception {
        ExitHandler onExit = exitStatus::complete;
        LocalEmulator started = LocalEmulator.builder(configBuilder()
                        .stayOpen(true)
                        .invokePort(invokePort)
                        .watch(watch)
                        .build())
                .exitHandler(onExit)
                .build();
        try {
            started.lifecycle().installSignalHandlers();
            started.start();
        } catch (RuntimeException e) {
            started.close();
            throw e;
        }
        emulator = started;
        log.info("Invoke API listening on {}:{}", started.config().runtimeApiHost(), started.invokePort());
        return exitStatus.get();
    }
}
