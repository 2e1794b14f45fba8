package com.example.resumeindex;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class IndexArtifactStoreTest {

    @TempDir
    Path tmp;

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    public void listsOnlyArtifactsOldestFirst() throws Exception {
        Files.writeString(tmp.resolve("resume_profiles_20240102T000000Z.idx"), "x");
        Files.writeString(tmp.resolve("resume_profiles_20231231T235959Z.idx"), "x");
        Files.writeString(tmp.resolve("notes.txt"), "x");
        Files.writeString(tmp.resolve(".resume_profiles_123.tmp"), "x");

        IndexArtifactStore store = new IndexArtifactStore(tmp.toString(), clock);

        assertThat(store.listArtifacts()).extracting(p -> p.getFileName().toString())
                .containsExactly("resume_profiles_20231231T235959Z.idx", "resume_profiles_20240102T000000Z.idx");
        assertThat(store.latest().getFileName().toString()).isEqualTo("resume_profiles_20240102T000000Z.idx");
    }

    @Test
    public void latestFailsWhenDirectoryHasNoArtifacts() {
        IndexArtifactStore store = new IndexArtifactStore(tmp.resolve("missing").toString(), clock);
        assertThat(store.listArtifacts()).isEmpty();
        assertThatThrownBy(store::latest).isInstanceOf(NotFoundException.class);
    }

    @Test
    public void loadDistinguishesMissingFromCorrupt() throws Exception {
        IndexArtifactStore store = new IndexArtifactStore(tmp.toString(), clock);
        Path garbage = tmp.resolve("resume_profiles_20240101T000000Z.idx");
        Files.writeString(garbage, "not an index");

        assertThatThrownBy(() -> store.load(tmp.resolve("nope.idx"))).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.load(garbage)).isInstanceOf(ValidationException.class);
    }

    @Test
    public void referenceIsAbsoluteAndNormalized() {
        Path relative = Path.of("data", "..", "data", "indexes", "x.idx");
        String ref = IndexArtifactStore.reference(relative);
        assertThat(Path.of(ref).isAbsolute()).isTrue();
        assertThat(ref).doesNotContain("..");
        assertThat(ref).isEqualTo(IndexArtifactStore.reference(relative.toAbsolutePath()));
    }
}
