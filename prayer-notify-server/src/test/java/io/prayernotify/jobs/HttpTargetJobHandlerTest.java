package io.prayernotify.jobs;

import io.prayernotify.core.HttpTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpTargetJobHandlerTest {

    private static final String URL = "http://dispatch.local/notifications/prayer";
    private static final String JSON = "{\"pushAddress\":\"tok\",\"title\":\"East Mosque\",\"body\":\"Fajr at 06:00\"}";

    private MockRestServiceServer server;
    private HttpTargetJobHandler handler;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        handler = new HttpTargetJobHandler(builder.build());
    }

    @Test
    void shouldPostDecodedBodyToTarget() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Content-Type", "application/json"))
                .andExpect(content().json(JSON))
                .andRespond(withSuccess("Success", MediaType.TEXT_PLAIN));

        handler.execute(HttpTarget.postJson(URL, JSON));

        server.verify();
    }

    @Test
    void serverErrorShouldPropagateSoTheQueueRetries() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> handler.execute(HttpTarget.postJson(URL, JSON)))
                .isInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void missingTargetShouldFail() {
        assertThatThrownBy(() -> handler.execute(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
