package inventory.adapter.in.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;

@QuarkusTest
@DisplayName("WhoAmIResource")
class WhoAmIResourceTest {

    @Test
    @DisplayName("should describe the admin caller")
    void shouldDescribeAdmin() {
        given().header("Authorization", Credentials.bearer(Credentials.tokenFor("admin")))
                .when()
                .get("/whoami")
                .then()
                .statusCode(200)
                .body("id", notNullValue())
                .body("name", notNullValue())
                .body("roles", contains("admin"))
                .body("expiresAt", notNullValue());
    }

    @Test
    @DisplayName("should deny roles without an Account grant")
    void shouldDenyUser() {
        given().header("Authorization", Credentials.bearer(Credentials.tokenFor("user")))
                .when()
                .get("/whoami")
                .then()
                .statusCode(403)
                .body("error", equalTo(
                        "Role 'user' does not have access to endpoint 'Account/WhoAmI' with action 'Read'."));
    }

    @Test
    @DisplayName("should require a token")
    void shouldRequireToken() {
        given().when().get("/whoami").then().statusCode(401);
    }
}
