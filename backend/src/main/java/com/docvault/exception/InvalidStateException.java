package com.docvault.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A request that is well-formed but conflicts with the current state of a share, ACL or request. */
public class InvalidStateException extends ErrorResponseException {

    public InvalidStateException(String title, String detail) {
        super(HttpStatus.CONFLICT, createProblem(title, detail), null);
    }

    private static ProblemDetail createProblem(String title, String detail) {
        var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
        problem.setTitle(title);
        problem.setDetail(detail);
        return problem;
    }
}
