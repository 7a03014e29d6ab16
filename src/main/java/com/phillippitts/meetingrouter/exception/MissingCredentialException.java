package com.phillippitts.meetingrouter.exception;

/**
 * Thrown when a mandatory credential resolves to nothing: no route override and no global value.
 */
public class MissingCredentialException extends MeetingRouterException {

    private final String credentialName;

    public MissingCredentialException(String credentialName, String routeName) {
        super("Missing " + credentialName + " for route '" + routeName + "'");
        this.credentialName = credentialName;
    }

    public String getCredentialName() {
        return credentialName;
    }
}
