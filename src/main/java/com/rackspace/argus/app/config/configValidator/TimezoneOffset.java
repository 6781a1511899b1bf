package com.rackspace.argus.app.config.configValidator;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import javax.validation.Constraint;
import javax.validation.Payload;

@Constraint(validatedBy = ConcreteTimezoneOffsetValidator.class)
@Target({ ElementType.FIELD })
@Retention(RetentionPolicy.RUNTIME)
public @interface TimezoneOffset {
  String message() default "Timezone offset must be +HH:MM or -HH:MM in 30 minute steps within -12:00..+12:00";
  Class<?>[] groups() default {};
  Class<? extends Payload>[] payload() default {};
}
