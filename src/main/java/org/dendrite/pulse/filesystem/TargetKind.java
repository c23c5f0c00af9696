package org.dendrite.pulse.filesystem;

/**
 * 跟随符号链接之后的目标类型；符号链接最终总是落在文件或目录上。
 */
public enum TargetKind {
    FILE,
    FOLDER
}
