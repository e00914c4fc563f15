package pgsync.demo;

import pgsync.mapping.TableMappingRegistry;
import pgsync.sync.SyncEngine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Dispatches the first non-option argument to {@link SyncCommands}.
 */
@Component
public class SyncCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(SyncCommandRunner.class);

  private final SyncCommands commands;
  private final TableMappingRegistry tables;
  private final SyncEngine engine;
  private int exitCode;

  public SyncCommandRunner(SyncCommands commands, TableMappingRegistry tables, SyncEngine engine) {
    this.commands = commands;
    this.tables = tables;
    this.engine = engine;
  }

  @Override
  public void run(ApplicationArguments args) {
    Command command;
    TableMappingRegistry selected;
    try {
      command = Command.parse(args, engine.batchSize());
      selected = TableSelection.select(tables, command.tables());
    } catch (IllegalArgumentException e) {
      log.error(e.getMessage());
      exitCode = 2;
      return;
    }
    if (selected != tables) {
      log.info("Filtering to {} of {} tables: {}", selected.size(), tables.size(), selected.names());
    }

    boolean ok = switch (command.name()) {
      case "setup" -> commands.setup(selected, command.recreate(), command.backfillQueue());
      case "sync" -> commands.sync(selected, command.batchSize());
      case "status" -> commands.status(selected);
      default -> throw new IllegalStateException("Unhandled command: " + command.name());
    };
    exitCode = ok ? 0 : 1;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  /**
   * Parsed command line.
   */
  record Command(String name, String tables, boolean recreate, boolean backfillQueue, int batchSize) {

    private static final List<String> NAMES = List.of("setup", "sync", "status");

    /**
     * @throws IllegalArgumentException if the command is missing or unknown, or the batch size is invalid
     */
    static Command parse(ApplicationArguments args, int defaultBatchSize) {
      List<String> positional = args.getNonOptionArgs();
      if (positional.isEmpty() || !NAMES.contains(positional.get(0))) {
        throw new IllegalArgumentException("Usage: " + String.join("|", NAMES)
            + " [--tables=a,b] [--recreate] [--backfill-queue] [--batch-size=N]");
      }
      int batchSize = defaultBatchSize;
      String batchOption = single(args, "batch-size");
      if (batchOption != null) {
        try {
          batchSize = Integer.parseInt(batchOption.trim());
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("--batch-size must be an integer: " + batchOption, e);
        }
        if (batchSize <= 0) {
          throw new IllegalArgumentException("--batch-size must be > 0");
        }
      }
      return new Command(positional.get(0), single(args, "tables"),
          args.containsOption("recreate"), args.containsOption("backfill-queue"), batchSize);
    }

    private static String single(ApplicationArguments args, String option) {
      List<String> values = args.getOptionValues(option);
      return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
  }
}
