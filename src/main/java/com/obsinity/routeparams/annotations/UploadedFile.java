package com.obsinity.routeparams.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a single uploaded file.
 *
 * <pre>
 *   public void upload(@UploadedFile("avatar") FilePart file) { ... }
 * </pre>
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface UploadedFile {
	/** Form field name of the file; unset binds the request's single file. */
	String value() default RouteParams.UNSET;
}
