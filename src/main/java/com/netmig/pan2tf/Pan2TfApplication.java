package com.netmig.pan2tf;

import com.netmig.pan2tf.cli.CommandLineInterface;
import lombok.extern.slf4j.Slf4j;

/**
 * Main application entry point for pan2tf
 * PAN-OS / Panorama configuration export to Terraform converter
 */
@Slf4j
public class Pan2TfApplication {

    public static void main(String[] args) {
        try {
            CommandLineInterface cli = new CommandLineInterface();
            System.exit(cli.execute(args));
        } catch (RuntimeException e) {
            log.error("Error executing pan2tf", e);
            System.err.println("\n❌ Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
