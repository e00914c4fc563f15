package pgsync.jdbc;

import java.util.List;

/**
 * Outcome of {@link PostgresSyncInstaller#install}.
 *
 * @param queueCreated     whether the queue table was created by this run
 * @param triggersCreated  triggers created by this run
 * @param triggersExisting triggers that were already in place
 */
public record SetupReport(boolean queueCreated, List<String> triggersCreated, List<String> triggersExisting) {

  public SetupReport {
    triggersCreated = List.copyOf(triggersCreated);
    triggersExisting = List.copyOf(triggersExisting);
  }
}
