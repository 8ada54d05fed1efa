package chronokms.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import chronokms.core.model.common.ConflictException;
import chronokms.core.model.common.ValidationException;
import chronokms.core.port.in.AuthorizationUseCase.KeyHolderUnavailableException;
import chronokms.core.port.in.SessionManagement.SessionCreationException;

/**
 * Maps core exceptions to RFC 7807 Problem Details.
 *
 * <p>Server-side failures are logged here and answered with a generic detail.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapValidationException(ValidationException e) {
        LOG.debugv("Validation error on {0}: {1}", e.field(), e.getMessage());
        return toResponse(KmsProblem.validationError(e.field(), e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(KmsProblem.validationError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapConflictException(ConflictException e) {
        LOG.debugv("Conflict: {0}", e.getMessage());
        return toResponse(KmsProblem.conflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapKeyHolderUnavailable(KeyHolderUnavailableException e) {
        LOG.warnv(e.getCause(), "Key holder unavailable: {0}", e.getMessage());
        return toResponse(KmsProblem.badGateway(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapSessionCreationException(SessionCreationException e) {
        LOG.errorv(e, "Session creation failed");
        return toResponse(KmsProblem.internalError("Unable to create session"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
