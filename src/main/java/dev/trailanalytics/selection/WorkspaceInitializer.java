package dev.trailanalytics.selection;

import dev.trailanalytics.race.RaceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads the manifest, preloads race metadata and applies the default selection once the
 * application has started. A missing manifest is logged and leaves the workspace empty.
 */
@Component
public class WorkspaceInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(WorkspaceInitializer.class);

  private final RaceCatalog raceCatalog;
  private final AnalyticsWorkspace workspace;

  public WorkspaceInitializer(RaceCatalog raceCatalog, AnalyticsWorkspace workspace) {
    this.raceCatalog = raceCatalog;
    this.workspace = workspace;
  }

  @Override
  public void run(ApplicationArguments args) {
    try {
      raceCatalog.loadManifest();
    } catch (IllegalStateException e) {
      log.error("Race manifest unavailable, starting with an empty workspace: {}", e.getMessage());
      return;
    }
    raceCatalog.preloadAll();
    workspace.selectDefaultYear();
  }
}
