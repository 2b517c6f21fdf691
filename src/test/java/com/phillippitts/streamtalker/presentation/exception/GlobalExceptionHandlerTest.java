package com.phillippitts.streamtalker.presentation.exception;

import com.phillippitts.streamtalker.domain.MessageEvent;
import com.phillippitts.streamtalker.domain.MessageState;
import com.phillippitts.streamtalker.exception.CacheStorageException;
import com.phillippitts.streamtalker.exception.IllegalStateTransitionException;
import com.phillippitts.streamtalker.exception.MessageNotFoundException;
import com.phillippitts.streamtalker.exception.StreamTalkerException;
import com.phillippitts.streamtalker.exception.SynthesisException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unknownMessageReturns404() {
        ResponseEntity<?> response = handler.handleMessageNotFound(new MessageNotFoundException(42));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString())
                .contains("MessageNotFoundException")
                .contains("Message not found")
                .contains("42");
    }

    @Test
    void outOfRangeValueReturns400WithReason() {
        ResponseEntity<?> response = handler.handleIllegalArgument(
                new IllegalArgumentException("volume must be between 0 and 100: 120"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("InvalidArgument")
                .contains("volume must be between 0 and 100");
    }

    @Test
    void validationErrorsListFields() {
        BeanPropertyBindingResult result = new BeanPropertyBindingResult(new Object(), "request");
        result.addError(new FieldError("request", "text", "must not be blank"));
        MethodArgumentNotValidException ex = mock(MethodArgumentNotValidException.class);
        when(ex.getBindingResult()).thenReturn(result);

        ResponseEntity<?> response = handler.handleValidation(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("ValidationFailed")
                .contains("text must not be blank");
    }

    @Test
    void illegalTransitionReturns409() {
        ResponseEntity<?> response = handler.handleIllegalTransition(
                new IllegalStateTransitionException(MessageState.DONE, MessageEvent.START_PLAYBACK));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("IllegalStateTransitionException");
    }

    @Test
    void synthesisFailureReturns503WithoutServerDetails() {
        SynthesisException ex = new SynthesisException("HTTP 500 from http://10.0.0.5:7860/generate_batch",
                "bob", 3);

        ResponseEntity<?> response = handler.handleSynthesisFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("TTS server temporarily unavailable")
                .doesNotContain("10.0.0.5");
    }

    @Test
    void cacheFailureDoesNotExposePaths() {
        CacheStorageException ex = new CacheStorageException("write failed for /secret/cache/abc.wav", "abc",
                new IOException("disk full"));

        ResponseEntity<?> response = handler.handleCacheStorage(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).doesNotContain("/secret/cache");
    }

    @Test
    void otherPipelineErrorsReturn500() {
        ResponseEntity<?> response = handler.handlePipelineFailure(new StreamTalkerException("broken"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("StreamTalkerException");
    }

    @Test
    void unexpectedErrorReturnsGenericBody() {
        ResponseEntity<?> response = handler.handleUnexpected(new NullPointerException("internal detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("internal detail")
                .matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
