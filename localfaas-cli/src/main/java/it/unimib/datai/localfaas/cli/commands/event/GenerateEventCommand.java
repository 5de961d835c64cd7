package it.unimib.datai.localfaas.cli.commands.event;

import it.unimib.datai.localfaas.cli.commands.RootCommand;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
        name = "generate-event",
        description = "Prints a sample trigger event, ready to pipe into 'invoke --stdin'.",
        subcommands = {
                S3EventCommand.class,
                SnsEventCommand.class,
                KinesisEventCommand.class,
                DynamoDbEventCommand.class,
                ApiEventCommand.class,
                ScheduleEventCommand.class
        }
)
public class GenerateEventCommand {

    @ParentCommand
    RootCommand root;
}
