package com.vidnyan.bpml.application.port.out;

import com.vidnyan.bpml.domain.model.Model;

import java.nio.file.Path;

/**
 * Port for loading the AST produced by the parser front end.
 * Implementations throw {@link ModelReadException} when the input cannot be read or mapped.
 */
public interface ModelSource {

    Model read(Path path);

    Model read(String content);
}
