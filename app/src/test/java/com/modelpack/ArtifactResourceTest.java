package com.modelpack;

import com.modelpack.core.artifact.BuildOptions;
import com.modelpack.core.artifact.BuildResult;
import com.modelpack.core.artifact.BuildService;
import com.modelpack.core.storage.ContentStore;
import com.modelpack.types.ArtifactCategory;
import com.modelpack.types.BuildSpec;
import com.modelpack.types.ModelMetadata;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class ArtifactResourceTest {

    @Inject
    BuildService builds;

    @Inject
    ContentStore store;

    private String repository;
    private BuildResult built;

    @BeforeEach
    void buildModel() throws IOException {
        Path workDir = Files.createTempDirectory("modelpack-work");
        Files.writeString(workDir.resolve("config.json"), "{\"hidden_size\":64}");
        Files.write(workDir.resolve("model.bin"), new byte[]{1, 2, 3, 4, 5, 6, 7, 8});
        Files.writeString(workDir.resolve("README.md"), "# tiny\n");
        BuildSpec spec = BuildSpec.builder()
                .add(ArtifactCategory.CONFIG, "config.json")
                .add(ArtifactCategory.WEIGHT, "model.bin")
                .add(ArtifactCategory.DOC, "README.md")
                .metadata(new ModelMetadata("tiny", "mlp", "tiny", "raw", "1k", "fp32", null, null, null,
                        Instant.parse("2024-05-01T00:00:00Z")))
                .build();

        repository = "localhost/test/m" + UUID.randomUUID().toString().replace("-", "");
        built = builds.build(spec, workDir, repository + ":v1", BuildOptions.defaults());
    }

    @Test
    void list_containsBuiltModel() {
        given()
                .when().get("/api/artifacts")
                .then()
                .statusCode(200)
                .body("find { it.repository == '" + repository + "' }.tag", is("v1"))
                .body("find { it.repository == '" + repository + "' }.digest", is(built.manifest().digest()))
                .body("find { it.repository == '" + repository + "' }.createdAt", startsWith("2024-05-01T00:00"));
    }

    @Test
    void inspect_returnsModelFacts() {
        given()
                .when().get("/api/artifacts/" + repository + "/v1")
                .then()
                .statusCode(200)
                .body("digest", is(built.manifest().digest()))
                .body("id", is(built.config().digest()))
                .body("name", is("tiny"))
                .body("architecture", is("mlp"))
                .body("layers.filepath", containsInAnyOrder("config.json", "model.bin", "README.md"));
    }

    @Test
    void inspect_unknownTag_returns404() {
        given()
                .when().get("/api/artifacts/" + repository + "/nope")
                .then()
                .statusCode(404)
                .body("error", containsString("Manifest not found"));
    }

    @Test
    void inspect_invalidRepository_returns400() {
        given()
                .when().get("/api/artifacts/NoHost/v1")
                .then()
                .statusCode(400);
    }

    @Test
    void gc_prunesOrphanedBlob() {
        byte[] orphan = ("orphan-" + repository).getBytes();
        String digest = store.pushBlob(repository, null, new ByteArrayInputStream(orphan))
                .await().indefinitely().digest().toString();

        given()
                .when().post("/api/gc")
                .then()
                .statusCode(200)
                .body("pruned.'" + repository + "'", hasItem(digest))
                .body("prunedCount", greaterThanOrEqualTo(1));

        given()
                .when().get("/api/artifacts/" + repository + "/v1")
                .then()
                .statusCode(200);
    }
}
