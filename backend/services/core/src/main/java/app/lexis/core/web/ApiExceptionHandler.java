package app.lexis.core.web;

import app.lexis.core.review.algorithm.InconsistentStateException;
import app.lexis.core.review.domain.InvalidRatingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidRatingException.class)
    public ResponseEntity<ProblemDetail> handleInvalidRating(InvalidRatingException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Invalid Rating");
        problem.setProperty("rating", ex.getToken());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(InconsistentStateException.class)
    public ResponseEntity<ProblemDetail> handleInconsistentState(InconsistentStateException ex) {
        log.warn("Rejected review on corrupted schedule: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
        problem.setTitle("Inconsistent Schedule State");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ProblemDetail> handleConcurrentUpdate(OptimisticLockingFailureException ex) {
        log.warn("Concurrent schedule update: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT,
                "The card was updated concurrently; fetch it again and retry.");
        problem.setTitle("Concurrent Update");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }
}
