package com.firesql.store;

/**
 * Opens {@link DocumentStore} connections for datasource settings.
 */
public interface DocumentStoreFactory {

    /**
     * Connect to the store identified by the settings.
     *
     * @throws DatasourceConfigException if the settings are invalid
     * @throws StoreException if the client cannot be created
     */
    DocumentStore connect(DatasourceSettings settings);
}
