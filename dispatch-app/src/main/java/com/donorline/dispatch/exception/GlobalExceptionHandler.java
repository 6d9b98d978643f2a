package com.donorline.dispatch.exception;

import com.donorline.dispatch.scheduling.InvalidScheduleConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidScheduleConfigException.class)
    public ProblemDetail handleInvalidConfig(InvalidScheduleConfigException ex) {
        log.warn("Rejected schedule config: {}", ex.getViolations());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Invalid schedule configuration");
        problem.setProperty("violations", ex.getViolations());
        return problem;
    }

    @ExceptionHandler(CampaignNotFoundException.class)
    public ProblemDetail handleCampaignNotFound(CampaignNotFoundException ex) {
        log.warn(ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Campaign not found");
        return problem;
    }

    /**
     * Stored rules that cannot be read back need fixing before the campaign can be scheduled.
     */
    @ExceptionHandler(ScheduleConfigFormatException.class)
    public ProblemDetail handleConfigFormat(ScheduleConfigFormatException ex) {
        log.error("Unreadable stored schedule config", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
        problem.setTitle("Stored schedule configuration is unreadable");
        return problem;
    }
}
