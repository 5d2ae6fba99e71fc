package io.github.drompincen.bugtrackr.runtime.policy;

import io.github.drompincen.bugtrackr.protocol.api.BugStatus;
import io.github.drompincen.bugtrackr.protocol.api.UserRole;
import io.github.drompincen.bugtrackr.protocol.error.DenialReason;
import org.springframework.stereotype.Component;

/**
 * Status workflow rules. Every move between the four states is allowed except:
 * <ul>
 *   <li>a Closed bug may only be changed by the elevated role;</li>
 *   <li>moving into Closed needs the validating or elevated role, and a validated bug.</li>
 * </ul>
 * Pure: no I/O, callers pass the freshly read state.
 */
@Component
public class TransitionPolicy {

    public TransitionDecision evaluate(BugStatus current, BugStatus requested, UserRole role, boolean validated) {
        if (current == BugStatus.CLOSED && !role.isElevated()) {
            return TransitionDecision.deny(DenialReason.INSUFFICIENT_ROLE, "Only Admin can modify closed bugs");
        }
        if (requested == BugStatus.CLOSED) {
            if (!role.canValidate()) {
                return TransitionDecision.deny(DenialReason.INSUFFICIENT_ROLE,
                        "Only Testers can close bugs");
            }
            if (!validated) {
                return TransitionDecision.deny(DenialReason.PRECONDITION_NOT_MET,
                        "Bug must be validated before closing");
            }
        }
        return TransitionDecision.allow(requested);
    }

    /** Gate for marking a bug validated. Depends on the role alone. */
    public TransitionDecision evaluateValidation(UserRole role) {
        if (!role.canValidate()) {
            return TransitionDecision.deny(DenialReason.INSUFFICIENT_ROLE, "Only Testers can validate bugs");
        }
        return TransitionDecision.permit();
    }
}
