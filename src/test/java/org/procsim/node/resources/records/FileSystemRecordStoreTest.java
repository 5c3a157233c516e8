package org.procsim.node.resources.records;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.procsim.node.api.resources.OperationalError;
import org.procsim.node.api.resources.records.LifecycleRecord;
import org.procsim.node.api.resources.records.RecordNotFoundException;

import com.typesafe.config.ConfigFactory;

@Tag("integration")
class FileSystemRecordStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemRecordStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemRecordStore("test-records",
                ConfigFactory.parseMap(Map.of("rootDirectory", tempDir.toAbsolutePath().toString())));
    }

    @Test
    void roundTripsRecordUnderItsFolder() throws IOException {
        LifecycleRecord record = new LifecycleRecord("silo-1", "Silo", List.of(Map.of("capacity", 50)));

        store.setItem(record, "Silo");

        Path file = tempDir.resolve("Silo").resolve("silo-1.json");
        assertThat(file).exists();
        assertThat(Files.readString(file, StandardCharsets.UTF_8))
                .contains("\"className\":\"Silo\"")
                .contains("\"capacity\":50");

        LifecycleRecord loaded = store.getItem("silo-1");
        assertThat(loaded.id()).isEqualTo("silo-1");
        assertThat(loaded.className()).isEqualTo("Silo");
        assertThat(loaded.args()).containsExactly(Map.of("capacity", 50L));
        assertThat(store.keys()).containsExactly("silo-1");
    }

    @Test
    void overwritesExistingRecord() throws IOException {
        store.setItem(new LifecycleRecord("meter", "EnergySimulator", List.of(Map.of("power", 3500))), "EnergySimulator");
        store.setItem(new LifecycleRecord("meter", "EnergySimulator", List.of(Map.of("power", 4200.5))), "EnergySimulator");

        assertThat(store.getItem("meter").args()).containsExactly(Map.of("power", 4200.5));
        assertThat(store.keys()).containsExactly("meter");
        try (var files = Files.list(tempDir.resolve("EnergySimulator"))) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void changingFolderMovesRecord() throws IOException {
        store.setItem(new LifecycleRecord("x", "Old", List.of()), "Old");
        store.setItem(new LifecycleRecord("x", "New", List.of()), "New");

        assertThat(tempDir.resolve("Old").resolve("x.json")).doesNotExist();
        assertThat(tempDir.resolve("New").resolve("x.json")).exists();
        assertThat(store.keys()).containsExactly("x");
        assertThat(store.getItem("x").className()).isEqualTo("New");
    }

    @Test
    void keysSpanAllFoldersAndIgnoreForeignFiles() throws IOException {
        store.setItem(new LifecycleRecord("b", "SiloSimulator", List.of()), "SiloSimulator");
        store.setItem(new LifecycleRecord("a", "EnergySimulator", List.of()), "EnergySimulator");
        Files.writeString(tempDir.resolve("SiloSimulator").resolve("notes.txt"), "ignored");
        Files.writeString(tempDir.resolve("top-level.json"), "{}");

        assertThat(store.keys()).containsExactly("a", "b");
    }

    @Test
    void removeIsIdempotent() throws IOException {
        store.setItem(new LifecycleRecord("gone", "Silo", List.of()), "Silo");

        store.removeItem("gone");
        store.removeItem("gone");
        store.removeItem("never-existed");

        assertThat(store.keys()).isEmpty();
        assertThat(store.getMetrics().get("records_removed")).isEqualTo(1L);
    }

    @Test
    void missingRecordRaisesNotFound() {
        assertThatThrownBy(() -> store.getItem("missing"))
                .isInstanceOf(RecordNotFoundException.class)
                .satisfies(e -> assertThat(((RecordNotFoundException) e).getId()).isEqualTo("missing"));
    }

    @Test
    void corruptRecordIsReportedAsIoError() throws IOException {
        Files.createDirectories(tempDir.resolve("Silo"));
        Files.writeString(tempDir.resolve("Silo").resolve("broken.json"), "{not json");

        assertThat(store.keys()).containsExactly("broken");
        assertThatThrownBy(() -> store.getItem("broken"))
                .isInstanceOf(IOException.class)
                .isNotInstanceOf(RecordNotFoundException.class);
        assertThat(store.getErrors()).extracting(OperationalError::code).contains("RECORD_CORRUPT");
    }

    @Test
    void roundTripsArbitraryIdStrings() throws IOException {
        List<String> ids = List.of("Silo 1", "hall:silo", "plant/line-2", "..", "a*b.c", "Zähler%20");
        for (String id : ids) {
            store.setItem(new LifecycleRecord(id, "SiloSimulator", List.of(Map.of("capacity", 10))), "SiloSimulator");
        }

        assertThat(store.keys()).containsExactlyInAnyOrderElementsOf(ids);
        for (String id : ids) {
            assertThat(store.getItem(id).id()).isEqualTo(id);
        }
        assertThat(tempDir.resolve("SiloSimulator").resolve("hall%3Asilo.json")).exists();
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(tempDir.resolve("SiloSimulator"));
        }

        store.removeItem("plant/line-2");
        assertThat(store.keys()).hasSize(ids.size() - 1).doesNotContain("plant/line-2");
    }

    @Test
    void unusualIdsStayInsideTheirFolder() throws IOException {
        store.setItem(new LifecycleRecord("../escape", "Silo", List.of()), "Silo");

        assertThat(tempDir.resolve("escape.json")).doesNotExist();
        assertThat(tempDir.getParent().resolve("escape.json")).doesNotExist();
        assertThat(store.keys()).containsExactly("../escape");
        assertThatThrownBy(() -> store.getItem("a/b")).isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void rejectsEmptyIdsAndUnsafeFolders() {
        assertThatThrownBy(() -> store.setItem(new LifecycleRecord("", "Silo", List.of()), "Silo"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.setItem(new LifecycleRecord("ok", "Silo", List.of()), "../outside"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.removeItem("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requiresAbsoluteRootDirectory() {
        assertThatThrownBy(() -> new FileSystemRecordStore("relative",
                ConfigFactory.parseMap(Map.of("rootDirectory", "relative/records"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absolute");
        assertThatThrownBy(() -> new FileSystemRecordStore("none", ConfigFactory.empty()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rootDirectory");
    }

    @Test
    void recordsSurviveNewStoreInstance() throws IOException {
        store.setItem(new LifecycleRecord("persisted", "SiloSimulator", List.of(Map.of("capacity", 80))), "SiloSimulator");

        FileSystemRecordStore reopened = new FileSystemRecordStore("reopened",
                ConfigFactory.parseMap(Map.of("rootDirectory", tempDir.toAbsolutePath().toString())));

        assertThat(reopened.keys()).containsExactly("persisted");
        assertThat(reopened.getItem("persisted").args()).containsExactly(Map.of("capacity", 80L));
    }
}
