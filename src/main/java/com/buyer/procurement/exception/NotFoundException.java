package com.buyer.procurement.exception;

/** A project, bill of materials, specification or product does not exist. Aborts the whole call. */
public class NotFoundException extends ProcurementException {

    private final String entity;
    private final Object id;

    public NotFoundException(String entity, Object id) {
        super(entity + " with id '" + id + "' not found");
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public Object getId() {
        return id;
    }
}
