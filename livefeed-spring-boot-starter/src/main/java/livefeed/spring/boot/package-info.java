/**
 * Spring Boot auto-configuration for livefeed.
 */
package livefeed.spring.boot;
