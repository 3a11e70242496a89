package com.flowline.coordinator.api;

import com.flowline.coordinator.service.BuildNotFoundException;
import com.flowline.coordinator.service.BuildTransitionException;
import com.flowline.coordinator.service.ConfigVersionConflictException;
import com.flowline.coordinator.service.JobNotFoundException;
import com.flowline.coordinator.service.PipelineNotFoundException;
import com.flowline.coordinator.service.TeamNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps service exceptions to HTTP statuses for every controller.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({
            BuildNotFoundException.class,
            PipelineNotFoundException.class,
            JobNotFoundException.class,
            TeamNotFoundException.class
    })
    public ProblemDetail notFound(RuntimeException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(BuildTransitionException.class)
    public ProblemDetail transition(BuildTransitionException e) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, e.getMessage());
        problem.setProperty("currentStatus", e.getCurrentStatus());
        return problem;
    }

    @ExceptionHandler(ConfigVersionConflictException.class)
    public ProblemDetail configConflict(ConfigVersionConflictException e) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, e.getMessage());
        problem.setProperty("expectedVersion", e.getExpectedVersion());
        problem.setProperty("actualVersion", e.getActualVersion());
        return problem;
    }

    @ExceptionHandler(TooManyEventStreamsException.class)
    public ProblemDetail tooManyStreams(TooManyEventStreamsException e) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        problem.setProperty("limit", e.getLimit());
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail badRequest(IllegalArgumentException e) {
        return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
    }
}
