package org.carball.pooltune.model.query;

public enum QueryType {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    CREATE,
    ALTER,
    DROP,
    INDEX,
    TRANSACTION,
    PROCEDURE,
    FUNCTION
}
