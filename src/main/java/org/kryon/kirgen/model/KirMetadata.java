package org.kryon.kirgen.model;

public class KirMetadata {
    public String sourceLanguage;
    public String sourceFile;
    public String compilerVersion;
    public String timestamp;
}
