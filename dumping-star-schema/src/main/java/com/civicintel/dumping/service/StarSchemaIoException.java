package com.civicintel.dumping.service;

import org.springframework.boot.ExitCodeGenerator;

/** Reading the extract or writing an export file failed. */
public class StarSchemaIoException extends RuntimeException implements ExitCodeGenerator {

    public StarSchemaIoException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return 1;
    }
}
