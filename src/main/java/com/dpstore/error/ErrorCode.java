package com.dpstore.error;

/**
 * Numeric error codes reported by store and lock operations.
 * DPS_* codes belong to stores and data items, DL_* codes to distributed locks.
 */
public enum ErrorCode {

    DPS_NO_ERROR(0),
    DPS_RUN_DATA_STORE_COMMAND_ERROR(99),
    DPS_INITIALIZE_ERROR(101),
    DPS_CONNECTION_ERROR(102),
    DPS_GUID_CREATION_ERROR(103),
    DPS_STORE_NAME_CREATION_ERROR(104),
    DPS_STORE_HASH_METADATA1_CREATION_ERROR(105),
    DPS_DATA_ITEM_WRITE_ERROR(107),
    DPS_DATA_ITEM_READ_ERROR(108),
    DPS_STORE_EXISTS(109),
    DPS_STORE_DOES_NOT_EXIST(110),
    DPS_DATA_ITEM_DELETE_ERROR(113),
    DPS_GET_STORE_ID_ERROR(114),
    DPS_GET_STORE_LOCK_ERROR(116),
    DPS_GET_STORE_NAME_ERROR(118),
    DPS_GET_DATA_ITEM_MALLOC_ERROR(125),
    DPS_STORE_ITERATION_DELETION_ERROR(131),
    DPS_GET_GENERIC_LOCK_ERROR(132),
    DPS_KEY_EXISTENCE_CHECK_ERROR(133),
    DPS_STORE_EXISTENCE_CHECK_ERROR(137),
    DPS_STORE_CLEARING_ERROR(139),
    DPS_GET_STORE_DATA_ITEM_KEYS_ERROR(141),
    DPS_INVALID_STORE_ID_ERROR(143),
    DPS_STORE_EMPTY_ERROR(144),
    DPS_STORE_HASH_METADATA2_CREATION_ERROR(145),
    DPS_STORE_HASH_METADATA3_CREATION_ERROR(146),
    DPS_GET_KEY_SPL_TYPE_NAME_ERROR(147),
    DPS_GET_VALUE_SPL_TYPE_NAME_ERROR(148),
    DPS_TTL_NOT_SUPPORTED_ERROR(153),
    DPS_STORE_FATAL_ERROR(156),
    DPS_AUTHENTICATION_ERROR(158),

    DL_CONNECTION_ERROR(501),
    DL_GET_LOCK_ID_ERROR(502),
    DL_GUID_CREATION_ERROR(503),
    DL_LOCK_NAME_CREATION_ERROR(504),
    DL_LOCK_INFO_CREATION_ERROR(505),
    DL_GET_DISTRIBUTED_LOCK_ERROR(506),
    DL_GET_LOCK_INFO_ERROR(507),
    DL_GET_LOCK_NAME_ERROR(508),
    DL_LOCK_INFO_UPDATE_ERROR(509),
    DL_GET_LOCK_ERROR(510),
    DL_LOCK_RELEASE_ERROR(511),
    DL_INVALID_LOCK_ID_ERROR(512),
    DL_GET_LOCK_TIMEOUT_ERROR(513),
    DL_LOCK_NOT_FOUND_ERROR(514),
    DL_LOCK_REMOVAL_ERROR(515);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    /**
     * Get the numeric code.
     *
     * @return the code as reported to callers
     */
    public int getCode() {
        return code;
    }

    /**
     * Check whether this code belongs to the distributed lock family.
     */
    public boolean isLockError() {
        return code >= 500;
    }

    /**
     * Look up a code by its numeric value.
     *
     * @param code the numeric code
     * @return the matching constant
     * @throws IllegalArgumentException if no constant has this code
     */
    public static ErrorCode fromCode(int code) {
        for (ErrorCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown error code: " + code);
    }
}
