package com.rackspace.argus.app.config.configValidator;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import javax.validation.Constraint;
import javax.validation.Payload;

@Constraint(validatedBy = ConcreteUploadFrequencyValidator.class)
@Target({ ElementType.FIELD })
@Retention(RetentionPolicy.RUNTIME)
public @interface SupportedUploadFrequency {
  String message() default "Upload frequency must be one of PT5M, PT10M, PT15M, PT30M or PT1H";
  Class<?>[] groups() default {};
  Class<? extends Payload>[] payload() default {};
}
