package com.agentrelay.dispatch.cli;

import com.agentrelay.core.engine.InvalidRequestException;
import com.agentrelay.core.engine.RunHandle;
import com.agentrelay.core.engine.Supervisor;
import com.agentrelay.core.events.RunEvent;
import com.agentrelay.core.model.AggregatedResult;
import com.agentrelay.core.model.RunMode;
import com.agentrelay.core.routing.SupervisorRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * CLI command: agentrelay prompt "&lt;text&gt;" [--url U]... [--stream]
 * <p>
 * Runs one prompt through the supervisor in-process. With {@code --stream}, each task is
 * printed as it finishes. Exits 0 on success, 1 on a failed run and 2 on an invalid request.
 */
@Command(name = "prompt", mixinStandardHelpOptions = true, description = "Run a prompt against the workers")
@Component
public class PromptCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Prompt text")
    private String prompt;

    @Option(names = {"--url", "-u"}, description = "URL to scrape (repeatable)")
    private List<String> urls = new ArrayList<>();

    @Option(names = {"--stream", "-s"}, description = "Print task events as they complete")
    private boolean stream;

    private final Supervisor supervisor;

    public PromptCommand(Supervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        RunHandle handle;
        try {
            handle = supervisor.submit(new SupervisorRequest(prompt, urls),
                    stream ? RunMode.STREAMING : RunMode.SYNCHRONOUS, null);
        } catch (InvalidRequestException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.info("Session " + handle.runId() + ": dispatching " + handle.taskIds().size()
                + " task" + (handle.taskIds().size() != 1 ? "s" : ""));

        AggregatedResult result;
        if (stream) {
            result = null;
            try (Stream<RunEvent> events = supervisor.stream(handle)) {
                for (RunEvent event : (Iterable<RunEvent>) events::iterator) {
                    if (event.isFinal()) {
                        result = event.result();
                    } else {
                        ConsoleOutput.taskEvent(event.type().wireName(), event.task());
                    }
                }
            }
            if (result == null) {
                ConsoleOutput.error("Stream ended without a result");
                return 1;
            }
        } else {
            result = supervisor.await(handle);
        }

        ConsoleOutput.result(result);
        return result.isError() ? 1 : 0;
    }
}
