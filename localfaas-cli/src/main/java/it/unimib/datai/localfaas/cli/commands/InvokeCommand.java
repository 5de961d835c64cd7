package it.unimib.datai.localfaas.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.localfaas.common.model.InvocationType;
import it.unimib.datai.localfaas.emulator.LocalEmulator;
import it.unimib.datai.localfaas.emulator.context.InvocationContext;
import it.unimib.datai.localfaas.emulator.dispatch.InvocationRequest;
import it.unimib.datai.localfaas.emulator.lifecycle.LifecycleController;
import it.unimib.datai.localfaas.emulator.supervisor.WorkerStartException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "invoke", description = "Runs a single invocation, prints the result and exits (1 on function error).")
public class InvokeCommand extends EmulatorCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(InvokeCommand.class);
    static final String DEFAULT_EVENT = "{}";

    @Parameters(index = "0", arity = "0..1", description = "Event payload (default: {}).")
    String payload;

    @Option(names = {"-e", "--event"}, description = "File holding the event payload; '-' reads stdin.")
    String eventFile;

    @Option(names = {"--stdin"}, description = "Read the event from stdin (env: DOCKER_LAMBDA_USE_STDIN).")
    boolean stdin;

    private final ObjectMapper json = new ObjectMapper();

    @Override
    public Integer call() throws Exception {
        byte[] event = readEvent();
        try (LocalEmulator emulator = LocalEmulator.builder(configBuilder().stayOpen(false).build())
                .exitHandler(root.exitHandler())
                .build()) {
            emulator.lifecycle().installSignalHandlers();
            emulator.start();
            InvocationContext context = emulator.invoke(
                    new InvocationRequest(event, InvocationType.REQUEST_RESPONSE, null, false));
            PrintStream out = System.out;
            if (context.failed()) {
                out.println(json.writeValueAsString(context.error()));
                return LifecycleController.EXIT_INVOCATION_ERROR;
            }
            out.write(context.response());
            out.println();
            out.flush();
            return LifecycleController.EXIT_OK;
        } catch (WorkerStartException e) {
            log.error("Fatal: {}", e.getMessage());
            return LifecycleController.EXIT_INVOCATION_ERROR;
        }
    }

    private byte[] readEvent() throws IOException {
        if (eventFile != null) {
            return eventFile.equals("-") ? System.in.readAllBytes() : Files.readAllBytes(Path.of(eventFile));
        }
        if (payload != null) {
            return payload.getBytes(StandardCharsets.UTF_8);
        }
        String useStdin = root.environment().apply("DOCKER_LAMBDA_USE_STDIN");
        if (stdin || (useStdin != null && !useStdin.isBlank())) {
            return System.in.readAllBytes();
        }
        return DEFAULT_EVENT.getBytes(StandardCharsets.UTF_8);
    }
}
