/**
 * Configuration classes bound from {@code application.yml}.
 */
package io.github.yok.marlea.config;
