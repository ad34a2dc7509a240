package com.ethnicthv.domain.service;

/**
 * Marker for stateless domain operations that belong to no single entity or value object.
 */
public interface DomainService {
}
