package com.github.danielflower.mavenplugins.releaseplan.plan;

import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import com.vdurmont.semver4j.Semver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The packages to release, in the order they were planned, and the packages that could not be planned.
 */
public class UpdatePlan {

    private final List<Entry> updates = new ArrayList<>();
    private final List<PackageFailure> failures = new ArrayList<>();
    private Semver workspaceVersion;
    private int propagationWaves;

    public void add(Package pkg, UpdateResult result) {
        updates.add(new Entry(pkg, result));
    }

    public void addFailure(PackageFailure failure) {
        failures.add(failure);
    }

    public List<Entry> getUpdates() {
        return Collections.unmodifiableList(updates);
    }

    public Optional<UpdateResult> find(String packageName) {
        for (Entry entry : updates) {
            if (entry.getPackage().getName().equals(packageName)) {
                return Optional.of(entry.getResult());
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return updates.isEmpty();
    }

    public List<PackageFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * @return the new version of the workspace, when packages inheriting it are released
     */
    public Optional<Semver> getWorkspaceVersion() {
        return Optional.ofNullable(workspaceVersion);
    }

    void setWorkspaceVersion(Semver workspaceVersion) {
        this.workspaceVersion = workspaceVersion;
    }

    /**
     * @return how many rounds of dependency propagation added packages to the plan
     */
    public int getPropagationWaves() {
        return propagationWaves;
    }

    void setPropagationWaves(int propagationWaves) {
        this.propagationWaves = propagationWaves;
    }

    public static final class Entry {
        private final Package pkg;
        private final UpdateResult result;

        Entry(Package pkg, UpdateResult result) {
            this.pkg = pkg;
            this.result = result;
        }

        public Package getPackage() {
            return pkg;
        }

        public UpdateResult getResult() {
            return result;
        }
    }

    /**
     * A package that could not be planned. Other packages are still planned.
     */
    public static final class PackageFailure {
        private final String packageName;
        private final String stage;
        private final List<String> messages;

        public PackageFailure(String packageName, String stage, List<String> messages) {
            this.packageName = packageName;
            this.stage = stage;
            this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
        }

        public String getPackageName() {
            return packageName;
        }

        /**
         * @return what was being done when the failure happened, for example "diff"
         */
        public String getStage() {
            return stage;
        }

        public List<String> getMessages() {
            return messages;
        }

        @Override
        public String toString() {
            return packageName + " (" + stage + "): " + String.join(" ", messages);
        }
    }
}
