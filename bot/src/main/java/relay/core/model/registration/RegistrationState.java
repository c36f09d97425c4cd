package relay.core.model.registration;

/**
 * Interaction state of a subject's registration.
 */
public enum RegistrationState {
    /** Registered privately; waiting for the command to be sent inside a group. */
    AWAITING_GROUP_CONTACT,

    /** Matched to a group the subject administers; the group id is ready to deliver. */
    FULFILLED
}
