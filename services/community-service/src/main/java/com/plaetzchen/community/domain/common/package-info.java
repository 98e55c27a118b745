/**
 * Exceptions and paging shared by all domain packages.
 *
 * <p>Domain services signal failures by throwing the exceptions in this package (or
 * {@code AccessDeniedException} / {@code AuthenticationRequiredException} from the security
 * library). {@code GlobalExceptionHandler} turns them into RFC 7807 responses, so controllers never
 * build error bodies themselves.
 */
package com.plaetzchen.community.domain.common;
