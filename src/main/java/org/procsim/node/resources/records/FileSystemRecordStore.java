package org.procsim.node.resources.records;

import java.io.File;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.procsim.node.api.resources.records.IRecordStore;
import org.procsim.node.api.resources.records.LifecycleRecord;
import org.procsim.node.api.resources.records.RecordNotFoundException;
import org.procsim.node.resources.AbstractResource;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.typesafe.config.Config;

/**
 * Record store that keeps one JSON file per record under a root directory:
 * <pre>
 *   rootDirectory/
 *     SiloSimulator/
 *       silo-1.json        {"className":"SiloSimulator","args":[{"capacity":50}]}
 *     EnergySimulator/
 *       3f0c...json
 * </pre>
 * Ids are percent-encoded into file names (including {@code .} and {@code *}), so any id
 * string can be stored; {@code "hall:silo 1"} becomes {@code hall%3Asilo+1.json}. Folder
 * names are not encoded and must be plain file names.
 * <p>
 * Writes go to a temporary file that is atomically moved into place, so a crash never
 * leaves a half-written record behind. Temporary files are ignored when listing.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>rootDirectory</b>: absolute path of the store directory (required, created if missing).</li>
 * </ul>
 */
public class FileSystemRecordStore extends AbstractResource implements IRecordStore {

    static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_\\-][A-Za-z0-9_.\\-]*");
    private static final Pattern ENCODED_NAME = Pattern.compile("[A-Za-z0-9_\\-%+]+");

    private final Gson gson = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .serializeNulls()
            .create();
    private final File rootDirectory;
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong removals = new AtomicLong();

    public FileSystemRecordStore(String name, Config options) {
        super(name, options);
        if (!options.hasPath("rootDirectory")) {
            throw new IllegalArgumentException("rootDirectory is required for FileSystemRecordStore");
        }
        String rootPath = options.getString("rootDirectory");
        this.rootDirectory = new File(rootPath);
        if (!this.rootDirectory.isAbsolute()) {
            throw new IllegalArgumentException("rootDirectory must be an absolute path: " + rootPath);
        }
        if (!this.rootDirectory.exists() && !this.rootDirectory.mkdirs()) {
            throw new IllegalArgumentException("Cannot create rootDirectory: " + rootPath);
        }
        if (!this.rootDirectory.isDirectory() || !this.rootDirectory.canWrite()) {
            throw new IllegalArgumentException("rootDirectory is not a writable directory: " + rootPath);
        }
    }

    public File getRootDirectory() {
        return rootDirectory;
    }

    @Override
    public synchronized List<String> keys() throws IOException {
        TreeSet<String> ids = new TreeSet<>();
        for (Path recordFile : listRecordFiles()) {
            try {
                ids.add(idOf(recordFile));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring file that is not a record: {}", recordFile);
            }
        }
        return new ArrayList<>(ids);
    }

    @Override
    public synchronized LifecycleRecord getItem(String id) throws IOException {
        List<Path> matches = locate(id);
        if (matches.isEmpty()) {
            throw new RecordNotFoundException(id);
        }
        Path file = matches.get(0);
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new RecordNotFoundException(id);
        }
        try {
            StoredValue value = gson.fromJson(json, StoredValue.class);
            if (value == null || value.className == null) {
                throw new IOException("Record file has no className: " + file);
            }
            return new LifecycleRecord(id, value.className, value.args);
        } catch (JsonParseException e) {
            recordError("RECORD_CORRUPT", "Record file cannot be decoded", "File: " + file);
            throw new IOException("Record file cannot be decoded: " + file, e);
        }
    }

    @Override
    public synchronized void setItem(LifecycleRecord record, String folder) throws IOException {
        String fileName = fileNameOf(record.id());
        validateName(folder, "folder");

        File targetDir = new File(rootDirectory, folder);
        if (!targetDir.isDirectory() && !targetDir.mkdirs()) {
            throw new IOException("Failed to create folder: " + targetDir.getAbsolutePath());
        }
        File targetFile = new File(targetDir, fileName);
        byte[] data = gson.toJson(new StoredValue(record.className(), record.args())).getBytes(StandardCharsets.UTF_8);

        File tempFile = new File(targetDir, targetFile.getName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        Files.write(tempFile.toPath(), data);
        try {
            moveIntoPlace(tempFile.toPath(), targetFile.toPath());
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile.toPath());
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile);
            }
            throw e;
        }

        // Keep ids unique when a record changes its folder
        for (Path stale : locate(record.id())) {
            if (!stale.equals(targetFile.toPath())) {
                Files.deleteIfExists(stale);
            }
        }
        writes.incrementAndGet();
        log.debug("Stored record '{}' in folder '{}'", record.id(), folder);
    }

    @Override
    public synchronized void removeItem(String id) throws IOException {
        for (Path file : locate(id)) {
            Files.deleteIfExists(file);
            removals.incrementAndGet();
            log.debug("Removed record file {}", file);
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("records_written", writes.get());
        metrics.put("records_removed", removals.get());
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private List<Path> locate(String id) throws IOException {
        String fileName = fileNameOf(id);
        List<Path> matches = new ArrayList<>();
        File[] folders = rootDirectory.listFiles(File::isDirectory);
        if (folders == null) {
            return matches;
        }
        for (File folder : folders) {
            File candidate = new File(folder, fileName);
            if (candidate.isFile()) {
                matches.add(candidate.toPath());
            }
        }
        Collections.sort(matches);
        return matches;
    }

    private List<Path> listRecordFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(rootDirectory.toPath(), 2)) {
            stream.filter(Files::isRegularFile)
                  .filter(p -> p.getParent() != null && !p.getParent().equals(rootDirectory.toPath()))
                  .filter(p -> p.getFileName().toString().endsWith(RECORD_SUFFIX))
                  .forEach(files::add);
        } catch (java.io.UncheckedIOException e) {
            throw new IOException("Failed to list records in " + rootDirectory, e.getCause());
        }
        return files;
    }

    /**
     * @throws IllegalArgumentException if the file name is not a valid encoding.
     */
    private static String idOf(Path recordFile) {
        String fileName = recordFile.getFileName().toString();
        String encoded = fileName.substring(0, fileName.length() - RECORD_SUFFIX.length());
        return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    }

    static String fileNameOf(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        String encoded = URLEncoder.encode(id, StandardCharsets.UTF_8)
                .replace("*", "%2A")
                .replace(".", "%2E");
        // Separators and dots are encoded, so the name cannot leave its folder
        if (!ENCODED_NAME.matcher(encoded).matches()) {
            throw new IllegalArgumentException("id cannot be encoded as a file name: " + id);
        }
        return encoded + RECORD_SUFFIX;
    }

    private static void validateName(String value, String what) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
        if (!SAFE_NAME.matcher(value).matches() || value.contains("..")) {
            throw new IllegalArgumentException(what + " contains characters not allowed in a file name: " + value);
        }
    }

    /**
     * On-disk JSON layout of a record. The id is the file name and not repeated inside.
     */
    private static final class StoredValue {
        private String className;
        private List<Object> args;

        StoredValue(String className, List<Object> args) {
            this.className = className;
            this.args = args;
        }
    }
}
