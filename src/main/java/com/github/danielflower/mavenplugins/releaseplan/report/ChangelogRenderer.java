package com.github.danielflower.mavenplugins.releaseplan.report;

import com.github.danielflower.mavenplugins.releaseplan.diff.Commit;
import com.vdurmont.semver4j.Semver;

import java.time.LocalDate;
import java.util.List;

/**
 * Turns the commits of a release into the changelog section for that release.
 */
public interface ChangelogRenderer {

    /**
     * @param previousVersion the version this release follows, or null for a first release
     */
    String render(String packageName, Semver nextVersion, LocalDate releaseDate, List<Commit> commits, String previousVersion);
}
