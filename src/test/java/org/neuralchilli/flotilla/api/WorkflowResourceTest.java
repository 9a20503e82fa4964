package org.neuralchilli.flotilla.api;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.config.EncoderConfig;
import io.restassured.config.RestAssuredConfig;
import io.restassured.http.ContentType;
import io.restassured.specification.RequestSpecification;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.flotilla.TestWorkflows;
import org.neuralchilli.flotilla.core.LifecycleStateMachine;
import org.neuralchilli.flotilla.core.WorkflowStore;
import org.neuralchilli.flotilla.executor.RecordingExecutor;
import org.neuralchilli.flotilla.quota.QuotaLedger;

import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;

@QuarkusTest
class WorkflowResourceTest {

    private static final String TRAINING = """
            name: rest-training
            pool: gpu-pool
            groups:
              - name: train
                tasks:
                  - name: master
                    lead: true
                    resources: { gpu: 1, cpu: 2 }
                  - name: worker
                    resources: { gpu: 1, cpu: 2 }
            """;

    private static final RestAssuredConfig YAML_BODY = RestAssuredConfig.config()
            .encoderConfig(EncoderConfig.encoderConfig().encodeContentTypeAs("application/yaml", ContentType.TEXT));

    @Inject
    WorkflowStore store;

    @Inject
    QuotaLedger ledger;

    @Inject
    LifecycleStateMachine lifecycle;

    @Inject
    RecordingExecutor executor;

    @BeforeEach
    void setup() {
        executor.reset();
        ledger.reset();
        ledger.configure(TestWorkflows.pools());
        store.clear();
        lifecycle.reset();
    }

    @AfterEach
    void cleanup() {
        executor.reset();
        store.clear();
        lifecycle.reset();
    }

    @Test
    void shouldSubmitYamlAndReportStatus() {
        String id = submit(TRAINING, "dave");

        given()
                .when().get("/api/v1/workflows/{id}", id)
                .then()
                .statusCode(200)
                .body("name", equalTo("rest-training"))
                .body("user", equalTo("dave"))
                .body("status", equalTo("RUNNING"))
                .body("groups[0].name", equalTo("train"))
                .body("groups[0].status", equalTo("INITIALIZING"))
                .body("groups[0].tasks", hasSize(2))
                .body("groups[0].tasks.name", hasItems("master", "worker"));

        given()
                .when().get("/api/v1/workflows/{id}/attempts", id)
                .then()
                .statusCode(200)
                .body("$", hasSize(2));
    }

    @Test
    void shouldSubmitAsAnonymousWithoutUser() {
        String id = yaml()
                .body(TRAINING)
                .when().post("/api/v1/workflows")
                .then()
                .statusCode(201)
                .extract().path("id");

        given()
                .when().get("/api/v1/workflows/{id}", id)
                .then()
                .statusCode(200)
                .body("user", equalTo("anonymous"));
    }

    @Test
    void shouldRejectInvalidWorkflowWithBadRequest() {
        yaml()
                .body("name: no-groups\npool: gpu-pool\n")
                .when().post("/api/v1/workflows")
                .then()
                .statusCode(400)
                .body("id", notNullValue())
                .body("status", equalTo("FAILED_SUBMISSION"))
                .body("error", containsString("must declare groups or tasks"));

        given()
                .when().get("/api/v1/workflows?status=failed_submission")
                .then()
                .statusCode(200)
                .body("$", hasSize(1))
                .body("[0].name", equalTo("unnamed"));
    }

    @Test
    void shouldCancelWorkflow() {
        String id = submit(TRAINING, "dave");

        given()
                .queryParam("user", "erin")
                .when().post("/api/v1/workflows/{id}/cancel", id)
                .then()
                .statusCode(200)
                .body("canceled", is(true));

        given()
                .when().delete("/api/v1/workflows/{id}", id)
                .then()
                .statusCode(200)
                .body("canceled", is(false));

        given()
                .when().get("/api/v1/workflows/{id}", id)
                .then()
                .statusCode(200)
                .body("status", equalTo("FAILED_CANCELED"))
                .body("canceledBy", equalTo("erin"));
    }

    @Test
    void shouldFilterHistory() {
        submit(TRAINING, "dave");
        submit(TRAINING.replace("rest-training", "other-training"), "frank");

        given()
                .queryParam("user", "frank")
                .when().get("/api/v1/workflows")
                .then()
                .statusCode(200)
                .body("$", hasSize(1))
                .body("[0].name", equalTo("other-training"));

        given()
                .queryParam("status", "not-a-status")
                .when().get("/api/v1/workflows")
                .then()
                .statusCode(400);
    }

    @Test
    void shouldReturnNotFoundForUnknownWorkflow() {
        given()
                .when().get("/api/v1/workflows/{id}", UUID.randomUUID().toString())
                .then()
                .statusCode(404)
                .body("error", containsString("not found"));
    }

    @Test
    void shouldReportPools() {
        given()
                .when().get("/api/v1/pools")
                .then()
                .statusCode(200)
                .body("pool", hasItems(TestWorkflows.POOL, TestWorkflows.SIBLING));

        given()
                .when().get("/api/v1/pools/{name}", TestWorkflows.POOL)
                .then()
                .statusCode(200)
                .body("backend", equalTo(TestWorkflows.BACKEND))
                .body("status", equalTo("ONLINE"));

        given()
                .when().get("/api/v1/pools/{name}", "nowhere")
                .then()
                .statusCode(404);
    }

    private String submit(String yaml, String user) {
        return yaml()
                .queryParam("user", user)
                .body(yaml)
                .when().post("/api/v1/workflows")
                .then()
                .statusCode(201)
                .body("id", notNullValue())
                .extract().path("id");
    }

    private static RequestSpecification yaml() {
        return given()
                .config(YAML_BODY)
                .contentType("application/yaml");
    }
}
