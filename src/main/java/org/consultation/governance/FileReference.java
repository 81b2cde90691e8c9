package org.consultation.governance;

import java.util.Objects;

/**
 * Opaque reference to an attachment held by an external file-storage component.
 * Passed through unmodified; never dereferenced.
 */
public class FileReference {
    private String kvsAddress;
    private String componentAddress;
    private String fileHash;

    public FileReference(String kvsAddress, String componentAddress, String fileHash) {
        this.kvsAddress = kvsAddress;
        this.componentAddress = componentAddress;
        this.fileHash = fileHash;
    }

    public String getKvsAddress() {
        return kvsAddress;
    }

    public String getComponentAddress() {
        return componentAddress;
    }

    public String getFileHash() {
        return fileHash;
    }

    @Override
    public String toString() {
        return "FileReference{" +
                "kvsAddress='" + kvsAddress + '\'' +
                ", componentAddress='" + componentAddress + '\'' +
                ", fileHash='" + fileHash + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        FileReference that = (FileReference) o;
        return Objects.equals(kvsAddress, that.kvsAddress) &&
                Objects.equals(componentAddress, that.componentAddress) &&
                Objects.equals(fileHash, that.fileHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kvsAddress, componentAddress, fileHash);
    }
}
