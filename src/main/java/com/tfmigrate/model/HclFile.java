package com.tfmigrate.model;

import lombok.Getter;
import lombok.NonNull;

import java.util.List;

/**
 * A parsed configuration file: a root body of top-level blocks and attributes.
 */
@Getter
public class HclFile {
    private final String fileName;
    private final Body body;

    public HclFile(String fileName, @NonNull Body body) {
        this.fileName = fileName;
        this.body = body;
    }

    public static HclFile empty() {
        Body body = new Body();
        body.setIndent("");
        return new HclFile(null, body);
    }

    public List<Block> getBlocks() {
        return body.getBlocks();
    }
}
