package inventory.adapter.in.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import inventory.core.config.TestJwtConfig;
import io.quarkus.test.junit.QuarkusTest;

@QuarkusTest
@DisplayName("AccountResource")
class AccountResourceTest {

    private static final String OTHER_SECRET = "qjw0hH3pd4nXhT1ODtD7nRLDxmvvmxQQW9bZr4KXaHo=";

    @Nested
    @DisplayName("GET /account")
    class ProvisionTests {

        @Test
        @DisplayName("should provision a user account by default")
        void shouldProvisionUser() {
            given().when()
                    .get("/account")
                    .then()
                    .statusCode(201)
                    .body("id", notNullValue())
                    .body("userName", notNullValue())
                    .body("password", notNullValue())
                    .body("apiKey", notNullValue())
                    .body("base64Encoded", notNullValue())
                    .body("roles", contains("user"));
        }

        @Test
        @DisplayName("should provision the requested role")
        void shouldProvisionRole() {
            given().queryParam("roleType", "Priviledged")
                    .when()
                    .get("/account")
                    .then()
                    .statusCode(201)
                    .body("roles", contains("priviledged"));
        }

        @Test
        @DisplayName("should not restrict loopback callers")
        void shouldNotRestrictLoopback() {
            given().queryParam("restrictIp", true)
                    .when()
                    .get("/account")
                    .then()
                    .statusCode(201)
                    .body("allowedIpAddresses", nullValue());
        }

        @Test
        @DisplayName("should reject an unknown role")
        void shouldRejectUnknownRole() {
            given().queryParam("roleType", "superuser")
                    .when()
                    .get("/account")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("Unknown role name: superuser"));
        }
    }

    @Nested
    @DisplayName("POST /account/token")
    class TokenTests {

        @Test
        @DisplayName("should issue a token for an API key")
        void shouldIssueForApiKey() {
            given().header("ApiKey", Credentials.apiKeyFor("user"))
                    .when()
                    .post("/account/token")
                    .then()
                    .statusCode(200)
                    .body("token", notNullValue());
        }

        @Test
        @DisplayName("should issue a token for Basic credentials")
        void shouldIssueForBasic() {
            final String basic = given().when().get("/account").then().statusCode(201).extract().path("base64Encoded");

            given().header("Authorization", "Basic " + basic)
                    .when()
                    .post("/account/token")
                    .then()
                    .statusCode(200)
                    .body("token", notNullValue());
        }

        @Test
        @DisplayName("should reject an unknown API key with masked headers")
        void shouldRejectUnknownApiKey() {
            given().header("ApiKey", "not-a-key")
                    .when()
                    .post("/account/token")
                    .then()
                    .statusCode(401)
                    .body("scheme", equalTo("ApiKey"))
                    .body("statuscode", equalTo(401))
                    .body("error", equalTo("Unauthorized"))
                    .body("message", equalTo("Invalid credentials or account not found"))
                    .body("headers.ApiKey", equalTo("***"));
        }

        @Test
        @DisplayName("should reject a wrong password")
        void shouldRejectWrongPassword() {
            final String username = given().when().get("/account").then().statusCode(201).extract().path("userName");
            final var basic = Base64.getEncoder()
                    .encodeToString((username + ":wrong").getBytes(StandardCharsets.UTF_8));

            given().header("Authorization", "Basic " + basic)
                    .when()
                    .post("/account/token")
                    .then()
                    .statusCode(401)
                    .body("scheme", equalTo("Basic"))
                    .body("message", equalTo("Invalid credentials or account not found"));
        }

        @Test
        @DisplayName("should explain the valid schemes when none is presented")
        void shouldExplainSchemes() {
            given().when()
                    .post("/account/token")
                    .then()
                    .statusCode(401)
                    .body("$", not(hasKey("scheme")))
                    .body("message", equalTo(
                            "Invalid authentication scheme. Valid options are ApiKey, Basic or OpenIdConnect/Bearer."));
        }
    }

    @Nested
    @DisplayName("POST /account/token/verify")
    class VerifyTests {

        @Test
        @DisplayName("should report the claims of a valid token")
        void shouldVerifyValidToken() {
            given().header("token", Credentials.tokenFor("admin"))
                    .header("secret", TestJwtConfig.SECRET)
                    .when()
                    .post("/account/token/verify")
                    .then()
                    .statusCode(200)
                    .body("valid", equalTo(true))
                    .body("claims.sub", notNullValue())
                    .body("claims.role", equalTo("admin"))
                    .body("$", not(hasKey("error")));
        }

        @Test
        @DisplayName("should reject a token signed with another secret")
        void shouldRejectOtherSecret() {
            given().header("token", Credentials.tokenFor("user"))
                    .header("secret", OTHER_SECRET)
                    .when()
                    .post("/account/token/verify")
                    .then()
                    .statusCode(400)
                    .body("valid", equalTo(false))
                    .body("error", equalTo("Invalid token signature"));
        }

        @Test
        @DisplayName("should require both headers")
        void shouldRequireHeaders() {
            given().header("token", "abc")
                    .when()
                    .post("/account/token/verify")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("token and secret headers are required"));
        }
    }
}
