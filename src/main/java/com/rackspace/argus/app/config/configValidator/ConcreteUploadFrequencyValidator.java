package com.rackspace.argus.app.config.configValidator;

import com.rackspace.argus.app.model.UploadFrequency;
import java.time.Duration;
import javax.validation.ConstraintValidator;
import javax.validation.ConstraintValidatorContext;

public class ConcreteUploadFrequencyValidator implements ConstraintValidator<SupportedUploadFrequency, Duration> {

  @Override
  public boolean isValid(Duration frequency, ConstraintValidatorContext constraintValidatorContext) {
    // @NotNull reports missing values
    if (frequency == null) {
      return true;
    }
    return UploadFrequency.isSupported(frequency);
  }
}
