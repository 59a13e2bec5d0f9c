package com.loanrecon.ingestion.oracle;

import com.loanrecon.domain.LoanDocument;
import com.loanrecon.ingestion.content.DocumentContent;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP oracle client using WebClient: POST {baseUrl}/classify with the document text, body parsed by
 * {@link OracleResponseParser}. Blocks on the calling intake thread.
 */
public class WebClientClassificationOracle implements ClassificationOracle {

    private final WebClient webClient;
    private final Duration timeout;
    private final OracleResponseParser parser;

    public WebClientClassificationOracle(WebClient.Builder builder, String baseUrl, Duration timeout,
                                         OracleResponseParser parser) {
        this.webClient = builder.baseUrl(baseUrl).build();
        this.timeout = timeout;
        this.parser = parser;
    }

    @Override
    public OracleJudgment classify(LoanDocument document, DocumentContent content) {
        Map<String, Object> body = new HashMap<>();
        body.put("documentId", document.getId());
        body.put("loanId", document.getLoanId());
        body.put("fileName", document.getFileName());
        body.put("pageCount", document.getPageCount());
        body.put("text", content != null && content.text() != null ? content.text() : "");
        String response;
        try {
            response = webClient.post()
                    .uri("/classify")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == 429) {
                throw new TransientOracleException("Oracle returned " + e.getStatusCode().value(), e);
            }
            throw new OracleException("Oracle rejected document " + document.getId() + ": " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw new TransientOracleException("Oracle unreachable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (e.getCause() instanceof TimeoutException) {
                throw new TransientOracleException("Oracle timed out after " + timeout.toMillis() + " ms", e);
            }
            throw e;
        }
        return parser.parse(response);
    }
}
