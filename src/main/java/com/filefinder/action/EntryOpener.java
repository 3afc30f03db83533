package com.filefinder.action;

import com.filefinder.catalog.FileEntry;

public interface EntryOpener {

    /**
     * 用系统默认程序打开文件，或在文件管理器中打开文件夹。
     *
     * @return 系统调用是否成功；失败只记录原因，不抛出异常
     */
    boolean open(FileEntry entry);
}
