package io.github.crudgraph.core.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ClientError implements ErrorDescriptor {

    // ==================== QUERY PARAMETERS ====================

    INVALID_FILTER_PARAMETER(HttpStatus.BAD_REQUEST, "Invalid filter",
            "Provided value for 'filter' parameter is invalid."),
    INVALID_FILTER_OPERATOR(HttpStatus.BAD_REQUEST, "Invalid filter operator",
            "Provided filter operator '{operator}' is invalid."),
    INVALID_IS_OPERATOR_VALUE(HttpStatus.BAD_REQUEST, "Invalid filter value",
            "Provided filter operator 'is' can only have 'null' value."),
    INVALID_SORT_BY_OPERATOR(HttpStatus.BAD_REQUEST, "Invalid sort",
            "Provided 'sort_by' parameter is invalid."),
    INVALID_UPDATED_SINCE_FIELD(HttpStatus.BAD_REQUEST, "Invalid filter",
            "Provided '{field}' filter is not supported by this resource."),
    INVALID_FORMAT_DATE_TIME(HttpStatus.BAD_REQUEST, "Invalid date format",
            "Provided '{field}' property should be in ISO format: YYYY-MM-DDTHH:MM:SSZ."),
    VALIDATION_MAXIMUM_PAGE_SIZE(HttpStatus.BAD_REQUEST, "Invalid page size",
            "The selected page size '{pageSize}' exceeds the maximum page of '{maximumPageSize}'."),
    VALIDATION_INVALID_PAGE(HttpStatus.BAD_REQUEST, "Invalid page",
            "Provided value '{value}' for '{parameter}' parameter should be a positive integer."),

    // ==================== INPUT VALIDATION ====================

    VALIDATION_IMMUTABLE_FIELD(HttpStatus.BAD_REQUEST, "Immutable field",
            "Field '{field}' cannot be updated."),
    VALIDATION_INVALID_RELATION(HttpStatus.BAD_REQUEST, "Invalid relation",
            "Provided id for field '{field}' is invalid."),

    // ==================== ACCESS ====================

    NO_ACCESS(HttpStatus.FORBIDDEN, "Forbidden",
            "You do not have access to {key} '{value}'."),
    NO_PERMISSIONS(HttpStatus.FORBIDDEN, "Forbidden",
            "You do not have enough permissions to perform this request."),
    ITEM_NOT_FOUND(HttpStatus.NOT_FOUND, "Not found",
            "The item does not exist or you do not have access."),
    OPERATION_NOT_SUPPORTED(HttpStatus.METHOD_NOT_ALLOWED, "Not supported",
            "Operation '{operation}' is not supported by this resource."),

    // ==================== OPERATION WRAPPERS ====================

    UNABLE_TO_LIST(HttpStatus.BAD_REQUEST, "Unable to list", "Items could not be listed."),
    UNABLE_TO_GET(HttpStatus.BAD_REQUEST, "Unable to get", "Item could not be retrieved."),
    UNABLE_TO_CREATE(HttpStatus.BAD_REQUEST, "Unable to create", "Item could not be created."),
    UNABLE_TO_UPDATE(HttpStatus.BAD_REQUEST, "Unable to update", "Item could not be updated."),
    UNABLE_TO_DELETE(HttpStatus.BAD_REQUEST, "Unable to delete", "Item could not be deleted.");

    private final HttpStatus status;
    private final String title;
    private final String messageTemplate;

    @Override
    public String getCode() {
        return name();
    }
}
