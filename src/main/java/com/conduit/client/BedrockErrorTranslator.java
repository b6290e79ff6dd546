package com.conduit.client;

import com.conduit.exception.ApiConnectionException;
import com.conduit.exception.ApiRequestException;
import com.conduit.exception.ApiServerException;
import com.conduit.exception.AuthenticationException;
import com.conduit.exception.GatewayException;
import com.conduit.exception.RateLimitException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.bedrockruntime.model.AccessDeniedException;
import software.amazon.awssdk.services.bedrockruntime.model.ModelNotReadyException;
import software.amazon.awssdk.services.bedrockruntime.model.ModelTimeoutException;
import software.amazon.awssdk.services.bedrockruntime.model.ResourceNotFoundException;
import software.amazon.awssdk.services.bedrockruntime.model.ServiceQuotaExceededException;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;
import software.amazon.awssdk.services.bedrockruntime.model.ValidationException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps AWS SDK failures onto the gateway's client error taxonomy.
 */
public final class BedrockErrorTranslator {

    private BedrockErrorTranslator() {
    }

    public static Throwable translate(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof GatewayException) {
            return cause;
        }

        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        if (cause instanceof AccessDeniedException) {
            return new AuthenticationException("Bedrock access denied: " + message, cause);
        }
        if (cause instanceof ThrottlingException || cause instanceof ServiceQuotaExceededException) {
            return new RateLimitException("Bedrock throttled the request: " + message, cause);
        }
        if (cause instanceof ValidationException || cause instanceof ResourceNotFoundException) {
            return new ApiRequestException("Bedrock rejected the request: " + message, cause);
        }
        if (cause instanceof ModelTimeoutException || cause instanceof ModelNotReadyException) {
            return new ApiServerException("Bedrock model unavailable: " + message, cause);
        }
        if (cause instanceof SdkServiceException) {
            int status = ((SdkServiceException) cause).statusCode();
            if (status == 401 || status == 403) {
                return new AuthenticationException("Bedrock authentication failed: " + message, cause);
            }
            if (status == 429) {
                return new RateLimitException("Bedrock rate limit exceeded: " + message, cause);
            }
            if (status >= 500) {
                return new ApiServerException("Bedrock server error (" + status + "): " + message, cause);
            }
            return new ApiRequestException("Bedrock request error (" + status + "): " + message, cause);
        }
        if (cause instanceof SdkClientException) {
            return new ApiConnectionException("Could not reach Bedrock: " + message, cause);
        }
        return cause;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
