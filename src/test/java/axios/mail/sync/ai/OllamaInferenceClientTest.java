package axios.mail.sync.ai;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OllamaInferenceClientTest {

    private static final String GENERATE_URL = "http://localhost:11434/api/generate";

    @Mock
    private RestTemplate restTemplate;

    private OllamaInferenceClient client;

    @BeforeEach
    void setUp() {
        client = new OllamaInferenceClient(restTemplate, "http://localhost:11434/", "llama3.2", 0.3);
    }

    @Test
    @SuppressWarnings("unchecked")
    void complete_ShouldRequestJsonAndReturnResponseField() {
        // Given
        when(restTemplate.postForObject(eq(GENERATE_URL), any(), eq(String.class)))
                .thenReturn("{\"model\":\"llama3.2\",\"response\":\"{\\\"tags\\\":[\\\"work\\\"]}\",\"done\":true}");

        // When
        String result = client.complete(InferenceRequest.builder().prompt("classify this").temperature(0.7).build());

        // Then
        assertEquals("{\"tags\":[\"work\"]}", result);
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(restTemplate).postForObject(eq(GENERATE_URL), captor.capture(), eq(String.class));
        Map<String, Object> body = (Map<String, Object>) captor.getValue();
        assertEquals("llama3.2", body.get("model"));
        assertEquals("json", body.get("format"));
        assertEquals(false, body.get("stream"));
        assertEquals(0.7, ((Map<String, Object>) body.get("options")).get("temperature"));
    }

    @Test
    void complete_WhenReadTimesOut_ShouldThrowTimeoutException() {
        // Given
        when(restTemplate.postForObject(eq(GENERATE_URL), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out")));

        // When
        InferenceException e = assertThrows(InferenceException.class,
                () -> client.complete(InferenceRequest.builder().prompt("classify this").build()));

        // Then
        assertTrue(e.isTimeout());
    }

    @Test
    void complete_WithEmptyResponseField_ShouldThrow() {
        // Given
        when(restTemplate.postForObject(eq(GENERATE_URL), any(), eq(String.class))).thenReturn("{\"response\":\"\"}");

        // When
        InferenceException e = assertThrows(InferenceException.class,
                () -> client.complete(InferenceRequest.builder().prompt("classify this").build()));

        // Then
        assertFalse(e.isTimeout());
    }
}
