/*
 * Where: Appointment service entry point
 * What: Boots Spring and scans configuration properties
 * Why: The no-show scheduler is started by its bootstrap listener, not here
 */
package com.clinicqueue.appointment;

import com.clinicqueue.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class AppointmentApplication {

  public static void main(String[] args) {
    SpringApplication.run(AppointmentApplication.class, args);
  }
}
