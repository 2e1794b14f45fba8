package com.example.resumeindex;

import com.example.resumeindex.testutils.TempDirs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {"spring.jpa.hibernate.ddl-auto=create-drop", "spring.datasource.url=jdbc:h2:mem:testdb;DB_CLOSE_DELAY=-1"})
public class ProfileStoreTest {

    private static final Path INDEX_DIR = TempDirs.create("store-test");

    @DynamicPropertySource
    static void indexDir(DynamicPropertyRegistry registry) {
        registry.add("index.dir", INDEX_DIR::toString);
    }

    @Autowired
    private ProfileStore store;

    @Autowired
    private ResumeProfileReader reader;

    @Autowired
    private ResumeProfileRepository repo;

    @BeforeEach
    public void clean() {
        repo.deleteAll();
    }

    private ResumeProfile profile(String name) {
        return reader.read("{\"personal_information\":{\"full_name\":\"" + name + "\"},\"skills\":[\"Java\"]}");
    }

    @Test
    public void upsertInsertsThenUpdatesKeepingCreatedAt() {
        ResumeProfileRecord first = store.upsert("cv-1", profile("Alice"), "extractor-v1", "/in/cv-1.pdf");
        ResumeProfileRecord second = store.upsert("cv-1", profile("Alice B."), "extractor-v2");

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(repo.count()).isEqualTo(1);
        ResumeProfileRecord stored = store.findByExternalId("cv-1");
        assertThat(stored.getCreatedAt()).isEqualTo(first.getCreatedAt());
        assertThat(stored.getUpdatedAt().compareTo(first.getUpdatedAt())).isGreaterThanOrEqualTo(0);
        assertThat(stored.getDisplayName()).isEqualTo("Alice B.");
        assertThat(stored.getProvenanceTag()).isEqualTo("extractor-v2");
        assertThat(stored.getProfileJson()).contains("\"full_name\":\"Alice B.\"");
        assertThat(stored.getIndexArtifactPath()).isNull();
    }

    @Test
    public void upsertRejectsBlankIdentifiers() {
        assertThatThrownBy(() -> store.upsert(" ", profile("A"), "tag")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.upsert("cv", profile("A"), "")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.upsert("cv", null, "tag")).isInstanceOf(ValidationException.class);
    }

    @Test
    public void selectionModesOrderByIdAndFilterAttachedRows() {
        long a = store.upsert("a", profile("A"), "t").getId();
        long b = store.upsert("b", profile("B"), "t").getId();
        long c = store.upsert("c", profile("C"), "t").getId();
        store.attachIndexArtifact(List.of(b), "/idx/one.idx");

        assertThat(store.selectForBackfill(BackfillMode.FULL)).extracting(ResumeProfileRecord::getId).containsExactly(a, b, c);
        assertThat(store.selectForBackfill(BackfillMode.MISSING)).extracting(ResumeProfileRecord::getId).containsExactly(a, c);
        assertThat(store.countPending()).isEqualTo(2);
        assertThat(store.count()).isEqualTo(3);
    }

    @Test
    public void attachTouchesExactlyTheGivenRows() {
        long a = store.upsert("a", profile("A"), "t").getId();
        long b = store.upsert("b", profile("B"), "t").getId();
        long c = store.upsert("c", profile("C"), "t").getId();
        store.attachIndexArtifact(List.of(c), "/idx/old.idx");

        int updated = store.attachIndexArtifact(List.of(a, b, a), "/idx/new.idx");

        assertThat(updated).isEqualTo(2);
        assertThat(store.findByExternalId("a").getIndexArtifactPath()).isEqualTo("/idx/new.idx");
        assertThat(store.findByExternalId("b").getIndexArtifactPath()).isEqualTo("/idx/new.idx");
        assertThat(store.findByExternalId("c").getIndexArtifactPath()).isEqualTo("/idx/old.idx");
    }

    @Test
    public void attachWithNoIdsIsANoOp() {
        store.upsert("a", profile("A"), "t");
        assertThat(store.attachIndexArtifact(List.of(), "/idx/x.idx")).isZero();
        assertThat(store.countPending()).isEqualTo(1);
    }

    @Test
    public void lookupReturnsRowsOfOneArtifactInIdOrder() {
        long a = store.upsert("a", profile("A"), "t").getId();
        long b = store.upsert("b", profile("B"), "t").getId();
        long c = store.upsert("c", profile("C"), "t").getId();
        store.attachIndexArtifact(List.of(c, a), "/idx/x.idx");
        store.attachIndexArtifact(List.of(b), "/idx/y.idx");

        List<ProfileStore.IndexedRow> rows = store.lookupByArtifact("/idx/x.idx");

        assertThat(rows).extracting(ProfileStore.IndexedRow::getId).containsExactly(a, c);
        assertThat(rows).extracting(ProfileStore.IndexedRow::getDisplayName).containsExactly("A", "C");
        assertThat(store.lookupByArtifact("/idx/unknown.idx")).isEmpty();
    }

    @Test
    public void reUpsertKeepsExistingArtifactReference() {
        long a = store.upsert("a", profile("A"), "t").getId();
        store.attachIndexArtifact(List.of(a), "/idx/x.idx");

        store.upsert("a", profile("A2"), "t");

        assertThat(store.findByExternalId("a").getIndexArtifactPath()).isEqualTo("/idx/x.idx");
        assertThat(store.selectForBackfill(BackfillMode.MISSING)).isEmpty();
    }

    @Test
    public void unknownExternalIdIsNotFound() {
        assertThatThrownBy(() -> store.findByExternalId("ghost")).isInstanceOf(NotFoundException.class);
    }
}
