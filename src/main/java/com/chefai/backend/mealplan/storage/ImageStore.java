package com.chefai.backend.mealplan.storage;

public interface ImageStore {

    /**
     * Copies a provider-hosted (expiring) image into our own storage.
     *
     * @return durable public URL, or null when the image could not be stored
     */
    String storeDurable(String transientUrl, String recordId) throws Exception;

    /** Removes whatever was stored for the record. No-op when nothing was. */
    void delete(String recordId) throws Exception;
}
