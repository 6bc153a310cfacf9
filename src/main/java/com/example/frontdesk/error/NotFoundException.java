package com.example.frontdesk.error;

/**
 * Operation on an unknown help request, knowledge entry or call id.
 */
public class NotFoundException extends FrontdeskException {

    private final String kind;
    private final Object id;

    public NotFoundException(String kind, Object id) {
        super(kind + " '" + id + "' not found");
        this.kind = kind;
        this.id = id;
    }

    public String kind() {
        return kind;
    }

    public Object id() {
        return id;
    }

    @Override
    public String code() {
        return "not_found";
    }
}
