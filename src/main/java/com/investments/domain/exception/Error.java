package com.investments.domain.exception;

/**
 * Coded error carried by a {@link ServiceException}
 */
public record Error(String code) {
}
