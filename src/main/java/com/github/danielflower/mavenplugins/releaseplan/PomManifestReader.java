package com.github.danielflower.mavenplugins.releaseplan;

import com.github.danielflower.mavenplugins.releaseplan.diff.ManifestReader;
import org.apache.maven.model.Dependency;
import org.apache.maven.model.Model;
import org.apache.maven.model.Parent;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.ReaderFactory;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Arrays.asList;

/**
 * Reads dependency versions from a <code>pom.xml</code>. The parent counts as a dependency, under the key
 * {@value #PARENT_PREFIX} plus its artifactId.
 */
public class PomManifestReader implements ManifestReader {

    public static final String PARENT_PREFIX = "parent:";

    @Override
    public Map<String, String> dependencyConstraints(Path manifest) throws ValidationException {
        Model model = read(manifest);
        Map<String, String> constraints = new TreeMap<>();
        Parent parent = model.getParent();
        if (parent != null) {
            constraints.put(PARENT_PREFIX + parent.getArtifactId(), nullToEmpty(parent.getVersion()));
        }
        for (Dependency dependency : model.getDependencies()) {
            constraints.put(dependency.getArtifactId(), nullToEmpty(dependency.getVersion()));
        }
        return constraints;
    }

    public static Model read(Path pom) throws ValidationException {
        try (Reader reader = ReaderFactory.newXmlReader(pom.toFile())) {
            return new MavenXpp3Reader().read(reader);
        } catch (IOException | XmlPullParserException e) {
            String summary = "Could not read " + pom;
            throw new ValidationException(summary, asList(summary, String.valueOf(e.getMessage())), e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
