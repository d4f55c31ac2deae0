package edu.washu.tag.provisioning.junit;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link edu.washu.tag.provisioning.client.ContentClient} parameter to be resolved as
 * the admin client instead of the shared user's client.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Admin {}
