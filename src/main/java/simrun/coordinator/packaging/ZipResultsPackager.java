package simrun.coordinator.packaging;

import simrun.coordinator.error.InvalidResultsDirectoryException;
import simrun.coordinator.error.PackagingException;
import simrun.coordinator.model.PackagedArtifact;
import simrun.coordinator.util.ScratchSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packages simulation output into a ZIP archive.
 * <p>
 * Output directories are named {@code RUN*} (case-insensitive). The archive keeps
 * the output directory name as top-level folder in both accepted shapes:
 * <ul>
 * <li>{@code /results/RUN4} gives {@code RUN4/out.csv}</li>
 * <li>{@code /results} holding {@code RUN1}, {@code RUN2} gives {@code RUN1/...}, {@code RUN2/...};
 * anything beside the RUN* folders is left out</li>
 * </ul>
 * Entries are written in archive-name order with a fixed timestamp and
 * compression level, so unchanged input yields identical bytes.
 * Symbolic links resolving outside the results directory are skipped.
 * <p>
 * The archive is assembled in a {@link ScratchSpace} that is deleted before returning.
 */
public class ZipResultsPackager implements ResultsPackager {

    private static final Logger log = LoggerFactory.getLogger(ZipResultsPackager.class);

    private static final String OUTPUT_DIR_PREFIX = "RUN";
    private static final long FIXED_ENTRY_TIME = LocalDateTime.of(1980, 1, 1, 0, 0)
            .atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    private static final int BUFFER_SIZE = 8192;

    private final Path scratchParent;

    public ZipResultsPackager(Path scratchParent) {
        this.scratchParent = scratchParent;
    }

    @Override
    public PackagedArtifact packageResults(Path directory) {
        validateDirectory(directory);

        List<Path> outputDirs = findOutputDirectories(directory);
        boolean singleOutputDir = isOutputDirectory(directory);

        if (outputDirs.isEmpty() && !singleOutputDir) {
            log.warn("No {}* directories found in {}", OUTPUT_DIR_PREFIX, directory);
            throw new InvalidResultsDirectoryException(directory, "No simulation output directories found");
        }

        if (outputDirs.isEmpty()) {
            log.info("Packaging single output directory {}", directory);
        } else {
            log.info("Packaging {} output directories in {}", outputDirs.size(), directory);
        }

        List<Entry> entries = collectEntries(directory, outputDirs);
        if (entries.isEmpty()) {
            log.warn("Results directory {} contains no files", directory);
        }

        try (ScratchSpace scratch = ScratchSpace.create(scratchParent, "simrun-package-")) {
            Path archive = scratch.resolve("results.zip");
            String checksum = writeArchive(archive, entries);
            byte[] payload = Files.readAllBytes(archive);
            long totalSize = entries.stream().mapToLong(Entry::size).sum();

            log.info("Created archive for {}: {} files, {} bytes of output, {} bytes zipped",
                    directory.getFileName(), entries.size(), totalSize, payload.length);

            return new PackagedArtifact(payload, entries.size(), totalSize, checksum,
                    directory.getFileName().toString());
        } catch (IOException | UncheckedIOException e) {
            log.error("Archive creation failed for {}", directory, e);
            throw new PackagingException("Failed to create results archive for " + directory, e);
        }
    }

    // --- Helpers ---

    private void validateDirectory(Path directory) {
        if (directory == null) {
            throw new InvalidResultsDirectoryException(null, "Results directory is required");
        }
        if (!Files.exists(directory)) {
            throw new InvalidResultsDirectoryException(directory, "Results directory does not exist");
        }
        if (!Files.isDirectory(directory)) {
            throw new InvalidResultsDirectoryException(directory, "Path is not a directory");
        }
        if (!Files.isReadable(directory)) {
            throw new InvalidResultsDirectoryException(directory, "Results directory is not readable");
        }
    }

    private List<Path> findOutputDirectories(Path directory) {
        try (Stream<Path> children = Files.list(directory)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(ZipResultsPackager::isOutputDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new PackagingException("Failed to list results directory " + directory, e);
        }
    }

    private static boolean isOutputDirectory(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toUpperCase(Locale.ROOT).startsWith(OUTPUT_DIR_PREFIX);
    }

    private List<Entry> collectEntries(Path directory, List<Path> outputDirs) {
        boolean singleShape = outputDirs.isEmpty();
        List<Path> targets = singleShape ? List.of(directory) : outputDirs;

        List<Entry> entries = new ArrayList<>();
        try {
            Path root = directory.toRealPath();
            for (Path target : targets) {
                try (Stream<Path> files = Files.walk(target)) {
                    for (Path file : (Iterable<Path>) files::iterator) {
                        if (!Files.isRegularFile(file)) {
                            continue;
                        }
                        if (!file.toRealPath().startsWith(root)) {
                            log.warn("Skipping file outside results root via symlink: {}", file);
                            continue;
                        }
                        String relative = archiveName(directory.relativize(file));
                        String name = singleShape ? directory.getFileName() + "/" + relative : relative;
                        entries.add(new Entry(file, name, Files.size(file)));
                    }
                }
            }
        } catch (IOException | UncheckedIOException e) {
            throw new PackagingException("Failed to read results directory " + directory, e);
        }
        entries.sort(Comparator.comparing(Entry::name));
        return entries;
    }

    private static String archiveName(Path relative) {
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    private String writeArchive(Path archive, List<Entry> entries) throws IOException {
        MessageDigest digest = sha256();
        try (OutputStream file = Files.newOutputStream(archive);
                DigestOutputStream digesting = new DigestOutputStream(file, digest);
                ZipOutputStream zip = new ZipOutputStream(digesting)) {

            zip.setLevel(Deflater.DEFAULT_COMPRESSION);
            byte[] buffer = new byte[BUFFER_SIZE];
            for (Entry entry : entries) {
                ZipEntry zipEntry = new ZipEntry(entry.name());
                zipEntry.setTime(FIXED_ENTRY_TIME);
                zip.putNextEntry(zipEntry);
                try (var in = Files.newInputStream(entry.file())) {
                    int read;
                    while ((read = in.read(buffer)) != -1) {
                        zip.write(buffer, 0, read);
                    }
                }
                zip.closeEntry();
                log.debug("Added to archive: {}", entry.name());
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record Entry(Path file, String name, long size) {
    }
}
