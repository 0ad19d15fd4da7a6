package warden.core.service.security.detector;

import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.security.SecurityEvent;

final class DetectorSupport {

    private static final Logger LOG = Logger.getLogger(DetectorSupport.class);

    private DetectorSupport() {}

    /**
     * Turn an audit query failure into "nothing detected".
     */
    static Uni<Optional<SecurityEvent>> orNothing(Uni<Optional<SecurityEvent>> detection, String detector) {
        return detection.onFailure().recoverWithItem(error -> {
            LOG.warnv(error, "Detector {0} could not read the audit log, skipping", detector);
            return Optional.empty();
        });
    }
}
