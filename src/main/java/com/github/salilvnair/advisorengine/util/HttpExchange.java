package com.github.salilvnair.advisorengine.util;

import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineErrorCode;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineException;
import com.github.salilvnair.advisorengine.engine.exception.TransientCallException;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Collection;
import java.util.Map;

/**
 * Single blocking HTTP exchange with failure classification.
 * <p>
 * IO failures and retryable status codes become {@link TransientCallException};
 * 401/403 map to the auth code; any other non-2xx maps to the failure code.
 */
@UtilityClass
public class HttpExchange {

    private static final int BODY_SNIPPET = 300;

    public static HttpResponse<String> send(
            HttpClient httpClient,
            HttpRequest request,
            String target,
            Collection<Integer> retryStatusCodes,
            AdvisorEngineErrorCode failureCode,
            AdvisorEngineErrorCode authFailureCode
    ) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException io) {
            throw new TransientCallException(target + " request failed: " + io.getClass().getSimpleName()
                    + (io.getMessage() == null ? "" : " " + io.getMessage()), io);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new AdvisorEngineException(failureCode, target + " request interrupted", interrupted);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response;
        }
        String snippet = JsonUtil.truncate(response.body() == null ? "" : response.body(), BODY_SNIPPET);
        if (retryStatusCodes != null && retryStatusCodes.contains(status)) {
            throw new TransientCallException(target + " returned retryable status " + status);
        }
        if (status == 401 || status == 403) {
            throw new AdvisorEngineException(authFailureCode, target + " rejected credentials with status " + status)
                    .withMetaData(Map.of("status", status));
        }
        throw new AdvisorEngineException(failureCode, target + " returned status " + status + ": " + snippet)
                .withMetaData(Map.of("status", status));
    }

    public static String join(String baseUrl, String path) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
