package com.example.k8sproxy.authz.client.dto;

import com.example.k8sproxy.authz.model.AuthorizationQuery;
import com.example.k8sproxy.authz.model.ResourceDescriptor;
import com.example.k8sproxy.authz.model.Verb;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SubjectAccessReview")
class SubjectAccessReviewTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should serialize the authorization.k8s.io/v1 request shape")
    void shouldSerializeRequestShape() throws Exception {
        AuthorizationQuery query = new AuthorizationQuery("alice", Verb.PATCH,
                new ResourceDescriptor("ns1", "apps", "v1", "deployments", "dep1", "scale"));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(SubjectAccessReview.forQuery(query)));

        assertThat(json.get("apiVersion").asText()).isEqualTo("authorization.k8s.io/v1");
        assertThat(json.get("kind").asText()).isEqualTo("SubjectAccessReview");
        assertThat(json.has("status")).isFalse();
        assertThat(json.at("/spec/user").asText()).isEqualTo("alice");

        JsonNode attributes = json.at("/spec/resourceAttributes");
        assertThat(attributes.get("namespace").asText()).isEqualTo("ns1");
        assertThat(attributes.get("verb").asText()).isEqualTo("patch");
        assertThat(attributes.get("group").asText()).isEqualTo("apps");
        assertThat(attributes.get("version").asText()).isEqualTo("v1");
        assertThat(attributes.get("resource").asText()).isEqualTo("deployments");
        assertThat(attributes.get("name").asText()).isEqualTo("dep1");
        assertThat(attributes.get("subresource").asText()).isEqualTo("scale");
    }

    @Test
    @DisplayName("should omit empty attributes")
    void shouldOmitEmptyAttributes() throws Exception {
        AuthorizationQuery query = new AuthorizationQuery("bob", Verb.GET,
                new ResourceDescriptor("", "", "v1", "nodes", "", ""));

        JsonNode attributes = objectMapper.readTree(objectMapper.writeValueAsString(SubjectAccessReview.forQuery(query)))
                .at("/spec/resourceAttributes");

        assertThat(attributes.has("namespace")).isFalse();
        assertThat(attributes.has("group")).isFalse();
        assertThat(attributes.has("name")).isFalse();
        assertThat(attributes.has("subresource")).isFalse();
        assertThat(attributes.get("resource").asText()).isEqualTo("nodes");
    }

    @Test
    @DisplayName("should read the response status and ignore unknown fields")
    void shouldReadResponseStatus() throws Exception {
        String response = """
                {
                  "apiVersion": "authorization.k8s.io/v1",
                  "kind": "SubjectAccessReview",
                  "metadata": {},
                  "spec": {"user": "alice", "uid": "1234"},
                  "status": {"allowed": false, "reason": "no RBAC policy matched", "evaluationError": "webhook timeout"}
                }
                """;

        SubjectAccessReview review = objectMapper.readValue(response, SubjectAccessReview.class);

        assertThat(review.status().allowed()).isFalse();
        assertThat(review.status().denied()).isFalse();
        assertThat(review.status().reason()).isEqualTo("no RBAC policy matched");
        assertThat(review.status().evaluationError()).isEqualTo("webhook timeout");
        assertThat(review.spec().user()).isEqualTo("alice");
    }
}
