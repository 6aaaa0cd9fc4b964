package ai.pipestream.history.http;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;

/**
 * HTTP tests for DocumentHistoryResource.
 * Identity arrives in the x-user-id header.
 */
@QuarkusTest
class DocumentHistoryResourceTest {

    @Test
    void testCreateAndFetchVersions() {
        String documentId = newDocumentId();

        String v1 = createVersion(documentId, "alice", "a\nb\nc\n", "initial");
        createVersion(documentId, "bob", "a\nx\nc\n", null);

        given()
                .when()
                .get("/documents/{documentId}/versions/{versionId}", documentId, v1)
                .then()
                .statusCode(200)
                .body("versionNumber", equalTo(1))
                .body("author", equalTo("alice"))
                .body("message", equalTo("initial"))
                .body("content", equalTo("a\nb\nc\n"));

        given()
                .when()
                .get("/documents/{documentId}/versions/current", documentId)
                .then()
                .statusCode(200)
                .body("versionNumber", equalTo(2))
                .body("author", equalTo("bob"));

        given()
                .when()
                .get("/documents/{documentId}/versions", documentId)
                .then()
                .statusCode(200)
                .body("versions", hasSize(2))
                .body("versions.versionNumber", contains(2, 1))
                .body("nextCursor", nullValue());
    }

    @Test
    void testPaging() {
        String documentId = newDocumentId();
        for (int i = 1; i <= 4; i++) {
            createVersion(documentId, "alice", "content " + i, null);
        }

        String cursor = given()
                .queryParam("limit", 3)
                .when()
                .get("/documents/{documentId}/versions", documentId)
                .then()
                .statusCode(200)
                .body("versions.versionNumber", contains(4, 3, 2))
                .body("nextCursor", notNullValue())
                .extract()
                .path("nextCursor");

        given()
                .queryParam("limit", 3)
                .queryParam("cursor", cursor)
                .when()
                .get("/documents/{documentId}/versions", documentId)
                .then()
                .statusCode(200)
                .body("versions.versionNumber", contains(1))
                .body("nextCursor", nullValue());
    }

    @Test
    void testCompare() {
        String documentId = newDocumentId();
        String v1 = createVersion(documentId, "alice", "a\nb\nc\n", null);
        createVersion(documentId, "alice", "a\nx\nc\n", null);

        given()
                .queryParam("from", v1)
                .queryParam("to", "current")
                .when()
                .get("/documents/{documentId}/compare", documentId)
                .then()
                .statusCode(200)
                .body("additions", equalTo(0))
                .body("deletions", equalTo(0))
                .body("modifications", equalTo(1))
                .body("changed", equalTo(true))
                .body("coarse", equalTo(false))
                .body("diff.type", contains("unchanged", "modify", "unchanged"))
                .body("diff[1].lineNumber", equalTo(2))
                .body("diff[1].oldContent", equalTo("b"))
                .body("diff[1].content", equalTo("x"));
    }

    @Test
    void testSideBySide() {
        String documentId = newDocumentId();
        String v1 = createVersion(documentId, "alice", "a\n", null);
        createVersion(documentId, "alice", "a\nb\n", null);

        given()
                .queryParam("from", v1)
                .when()
                .get("/documents/{documentId}/compare/side-by-side", documentId)
                .then()
                .statusCode(200)
                .body("additions", equalTo(1))
                .body("rows", hasSize(2))
                .body("rows[1].type", equalTo("add"))
                .body("rows[1].oldSide", nullValue())
                .body("rows[1].newSide.lineNumber", equalTo(2))
                .body("rows[1].newSide.text", equalTo("b"));
    }

    @Test
    void testCompareWithDraft() {
        String documentId = newDocumentId();
        createVersion(documentId, "alice", "a\nb\n", null);

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("lines", new String[]{"a", "b", "c"}))
                .when()
                .post("/documents/{documentId}/compare/draft", documentId)
                .then()
                .statusCode(200)
                .body("additions", equalTo(1))
                .body("diff[2].type", equalTo("add"));
    }

    @Test
    void testRollback() {
        String documentId = newDocumentId();
        String v1 = createVersion(documentId, "alice", "original\n", null);
        createVersion(documentId, "bob", "changed\n", null);

        given()
                .header("x-user-id", "carol")
                .when()
                .post("/documents/{documentId}/versions/{versionId}/rollback", documentId, v1)
                .then()
                .statusCode(200)
                .body("versionNumber", equalTo(3))
                .body("content", equalTo("original\n"))
                .body("author", equalTo("carol"))
                .body("message", startsWith("Rolled back to version 1"));

        given()
                .when()
                .get("/documents/{documentId}/statistics", documentId)
                .then()
                .statusCode(200)
                .body("totalVersions", equalTo(3))
                .body("totalChangedLines", equalTo(2))
                .body("approximate", equalTo(false))
                .body("contributors", contains("alice", "bob", "carol"));
    }

    @Test
    void testErrorsMapToStatusCodes() {
        String documentId = newDocumentId();

        given()
                .when()
                .get("/documents/{documentId}/versions/current", documentId)
                .then()
                .statusCode(404)
                .body("error", equalTo("DOCUMENT_NOT_FOUND"))
                .body("operation", equalTo("getCurrentVersion"));

        String v1 = createVersion(documentId, "alice", "one", null);

        given()
                .when()
                .get("/documents/{documentId}/versions/{versionId}", documentId, "missing")
                .then()
                .statusCode(404)
                .body("error", equalTo("VERSION_NOT_FOUND"));

        given()
                .queryParam("limit", 0)
                .when()
                .get("/documents/{documentId}/versions", documentId)
                .then()
                .statusCode(400)
                .body("error", equalTo("INVALID_INPUT"));

        given()
                .when()
                .post("/documents/{documentId}/versions/{versionId}/rollback", documentId, v1)
                .then()
                .statusCode(400)
                .body("error", equalTo("INVALID_INPUT"));

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("content", "text"))
                .when()
                .post("/documents/{documentId}/versions", documentId)
                .then()
                .statusCode(400)
                .body("error", equalTo("INVALID_INPUT"));
    }

    @Test
    void testReadinessReportsStore() {
        createVersion(newDocumentId(), "alice", "text", null);

        given()
                .when()
                .get("/q/health/ready")
                .then()
                .statusCode(200)
                .body("status", equalTo("UP"))
                .body("checks.find { it.name == 'document-history-service' }.status", equalTo("UP"));
    }

    private static String createVersion(String documentId, String author, String content, String message) {
        Map<String, String> body = message == null
                ? Map.of("content", content)
                : Map.of("content", content, "message", message);
        return given()
                .header("x-user-id", author)
                .contentType(ContentType.JSON)
                .body(body)
                .when()
                .post("/documents/{documentId}/versions", documentId)
                .then()
                .statusCode(201)
                .extract()
                .path("id");
    }

    private static String newDocumentId() {
        return "doc-" + UUID.randomUUID();
    }
}
