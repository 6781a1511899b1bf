package com.rackspace.argus.app.config.configValidator;

import com.rackspace.argus.app.exceptions.InvalidConfigException;
import com.rackspace.argus.app.utils.DateTimeUtils;
import javax.validation.ConstraintValidator;
import javax.validation.ConstraintValidatorContext;

public class ConcreteTimezoneOffsetValidator implements ConstraintValidator<TimezoneOffset, String> {

  @Override
  public boolean isValid(String offset, ConstraintValidatorContext constraintValidatorContext) {
    if (offset == null) {
      return true;
    }
    try {
      DateTimeUtils.parseTimezoneOffset(offset);
      return true;
    } catch (InvalidConfigException e) {
      return false;
    }
  }
}
