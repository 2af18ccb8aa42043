package com.makestar.e2e.auth.junit;

import com.makestar.e2e.auth.TargetSite;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Selects the site whose session {@link AuthenticatedSessionExtension} prepares. Defaults to
 * {@link TargetSite#ADMIN} when absent.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
public @interface AuthenticatedSite {
    TargetSite value();
}
