package org.carball.compadvisor.ddl;

import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ObjectRef;

/**
 * What a template needs to render one statement.
 *
 * @param storageArea tablespace to pin the object to, or null to leave it where it is
 */
public record DdlRequest(ObjectRef ref, Encoding encoding, String storageArea, boolean online) {}
