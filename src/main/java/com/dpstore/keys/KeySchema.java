package com.dpstore.keys;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Set;

/**
 * Maps stores, locks and data items onto backend keys.
 *
 * Every entity class gets its own prefix tag so unrelated entities never collide
 * in the flat backend keyspace:
 * <pre>
 *   store name -> id      "0"   + base64(name)
 *   store contents        "1"   + storeId
 *   store lock            "4"   + storeId + "dps_lock"
 *   lock name -> id       "5"   + base64(name)
 *   lock info             "6"   + lockId
 *   lock token            "7"   + lockId + "dl_lock"
 *   general purpose lock  "501" + base64(name) + "generic_lock"
 *   TTL item              "9"   + base64(key), or the unframed key text
 * </pre>
 * Item keys inside a store container are base64 encoded. The base64 alphabet has
 * no underscore, so an encoded item key can never equal one of the reserved
 * metadata field names.
 */
public final class KeySchema {

    public static final String GUID_KEY = "dps_and_dl_guid";

    public static final String TAG_STORE_NAME = "0";
    public static final String TAG_STORE_CONTENTS = "1";
    public static final String TAG_STORE_LOCK = "4";
    public static final String TAG_LOCK_NAME = "5";
    public static final String TAG_LOCK_INFO = "6";
    public static final String TAG_LOCK_TOKEN = "7";
    public static final String TAG_GENERIC_LOCK = "501";
    public static final String TAG_TTL_ITEM = "9";

    public static final String STORE_LOCK_SUFFIX = "dps_lock";
    public static final String LOCK_TOKEN_SUFFIX = "dl_lock";
    public static final String GENERIC_LOCK_SUFFIX = "generic_lock";

    // Reserved metadata fields present in every store container
    public static final String FIELD_STORE_NAME = "dps_name_of_this_store";
    public static final String FIELD_KEY_TYPE = "dps_spl_type_name_of_key";
    public static final String FIELD_VALUE_TYPE = "dps_spl_type_name_of_value";
    public static final int RESERVED_FIELD_COUNT = 3;

    private static final Set<String> RESERVED_FIELDS =
        Set.of(FIELD_STORE_NAME, FIELD_KEY_TYPE, FIELD_VALUE_TYPE);

    private KeySchema() {
        // Utility class
    }

    public static String storeNameKey(String storeName) {
        return TAG_STORE_NAME + encode(storeName);
    }

    public static String storeContentsKey(long storeId) {
        return TAG_STORE_CONTENTS + storeId;
    }

    public static String storeLockKey(long storeId) {
        return TAG_STORE_LOCK + storeId + STORE_LOCK_SUFFIX;
    }

    public static String lockNameKey(String lockName) {
        return TAG_LOCK_NAME + encode(lockName);
    }

    public static String lockInfoKey(long lockId) {
        return TAG_LOCK_INFO + lockId;
    }

    public static String lockTokenKey(long lockId) {
        return TAG_LOCK_TOKEN + lockId + LOCK_TOKEN_SUFFIX;
    }

    /**
     * Key of the short-lived lock guarding creation of the named entity.
     *
     * @param encodedEntityName the entity name, already base64 encoded
     */
    public static String genericLockKey(String encodedEntityName) {
        return TAG_GENERIC_LOCK + encodedEntityName + GENERIC_LOCK_SUFFIX;
    }

    /**
     * Backend key of an item in the TTL namespace.
     *
     * @param itemKey the item key as it should appear after the tag, already encoded or unframed
     */
    public static String ttlItemKey(String itemKey) {
        return TAG_TTL_ITEM + itemKey;
    }

    /**
     * Encode an item key for use as a container field name.
     */
    public static String itemField(byte[] key) {
        return Base64.getEncoder().encodeToString(key);
    }

    /**
     * Decode a container field name back to the caller's item key.
     *
     * @throws IllegalArgumentException if the field is not valid base64
     */
    public static byte[] itemKey(String field) {
        return Base64.getDecoder().decode(field);
    }

    /**
     * Check if a container field is one of the three reserved metadata fields.
     */
    public static boolean isReservedField(String field) {
        return RESERVED_FIELDS.contains(field);
    }

    /**
     * Base64 encode a UTF-8 string.
     */
    public static String encode(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decode base64 text to a UTF-8 string.
     *
     * @throws IllegalArgumentException if the text is not valid base64
     */
    public static String decode(String base64) {
        return new String(Base64.getDecoder().decode(base64), StandardCharsets.UTF_8);
    }
}
