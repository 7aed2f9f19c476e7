package simrun.coordinator.packaging;

import simrun.coordinator.model.PackagedArtifact;

import java.nio.file.Path;

/**
 * Turns a simulation results directory into a storable artifact.
 */
public interface ResultsPackager {

    /**
     * Package a results directory.
     * <p>
     * Accepts either a single output directory ({@code RUN*}) or a parent
     * containing one or more of them. Unchanged input always yields the same checksum.
     *
     * @param directory the results directory
     * @return the packaged artifact
     * @throws simrun.coordinator.error.InvalidResultsDirectoryException if neither shape is found
     * @throws simrun.coordinator.error.PackagingException on any read or archive error
     */
    PackagedArtifact packageResults(Path directory);
}
