/**
 * Non-cryptographic hashing used to derive stable event-type identifiers.
 *
 * @see eventmanager.hash.Murmur3
 * @see eventmanager.EventTypeId
 */
package eventmanager.hash;
