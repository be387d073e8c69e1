package io.github.riemr.voucher.presentation.controller;

import io.github.riemr.voucher.application.exception.RosterUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RosterUnavailableException.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleRosterUnavailable(RosterUnavailableException e) {
        log.warn("Voucher run aborted: {}", e.getMessage());

        Map<String, Object> response = new HashMap<>();
        response.put("error", "Roster unavailable");
        response.put("message", e.getMessage());
        return new ResponseEntity<>(response, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(Exception.class)
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleVoucherFailure(Exception e, HttpServletRequest request) {
        String competence = request.getParameter("competence");
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        log.error("Voucher request {} failed (competence={})", request.getRequestURI(), competence, e);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", "Voucher run failed");
        response.put("path", request.getRequestURI());
        response.put("competence", competence);
        response.put("message", e.getMessage());
        response.put("cause", cause.getClass().getSimpleName());
        response.put("causeMessage", cause.getMessage());
        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
