/**
 * Collaborator ports for the data the engine reads and writes.
 *
 * <p>Stations and hack sessions are owned by the engine. Game users, filler
 * passwords and the round are owned elsewhere and only read here.
 * Adapters wrap their native failures in
 * {@link com.questrail.lantern.api.StorageException}.</p>
 */
package com.questrail.lantern.store;
