package com.filefinder.config;

import java.util.Map;
import java.util.Set;

/**
 * 全局常量定义
 * 
 * 包含目录排除集、扩展名策略、评分参数、检索参数和元数据键
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 索引排除规则 ====================
    /** 遍历时整棵剪枝的目录名（依赖缓存、版本控制元数据、系统目录、回收站） */
    public static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
        "node_modules", ".venv", "venv", ".cache", ".vscode", ".next", ".git", "__pycache__",
        "$RECYCLE.BIN", "System Volume Information", "AppData", "Support Files",
        "Program Files", "Program Files (x86)", "Windows"
    );
    /** 始终拒绝的二进制/临时文件扩展名（不含点） */
    public static final Set<String> BLOCKED_EXTENSIONS = Set.of(
        "dll", "exe", "sys", "tmp", "log", "cache", "bin", "dat", "iso"
    );
    /** 默认白名单，为空集合时表示除黑名单外全部收录 */
    public static final Set<String> DEFAULT_ALLOWED_EXTENSIONS = Set.of(
        "txt", "md", "py", "json", "docx", "pdf", "xlsx", "csv", "pptx", "html", "js", "ts"
    );

    // ==================== 评分参数 ====================
    /** 低于该总分的候选被丢弃 */
    public static final double MIN_SCORE = 70.0;
    public static final double EXACT_MATCH_BOOST = 40.0;
    public static final double PARTIAL_MATCH_BOOST = 20.0;
    public static final double NAME_OVER_PATH_BOOST = 15.0;
    public static final double RECENCY_BOOST_DAY = 20.0;
    public static final double RECENCY_BOOST_WEEK = 10.0;
    public static final double RECENCY_BOOST_MONTH = 5.0;
    public static final double EXTENSION_INTENT_BOOST = 25.0;
    /** 每个出现在路径中的查询词的加分 */
    public static final double FOLDER_CONTEXT_BOOST = 5.0;
    /** 每个路径分隔符的扣分 */
    public static final double DEPTH_PENALTY_PER_LEVEL = 0.5;
    /** 查询关键字 → 期望扩展名（不含点） */
    public static final Map<String, String> EXTENSION_KEYWORDS = Map.of(
        "pdf", "pdf",
        "word", "docx",
        "doc", "docx",
        "excel", "xlsx",
        "sheet", "xlsx",
        "powerpoint", "pptx",
        "presentation", "pptx"
    );

    // ==================== 检索参数 ====================
    /** 粗筛阶段的候选行上限 */
    public static final int CANDIDATE_CAP = 300;
    public static final int DEFAULT_SEARCH_LIMIT = 5;
    public static final int MAX_SEARCH_LIMIT = 100;
    public static final int MAX_QUERY_LENGTH = 256;
    /** list 动作最多展示的子项数量 */
    public static final int LIST_PREVIEW_LIMIT = 30;

    // ==================== 元数据键 ====================
    /** 根目录首次全量构建完成标记的键前缀 */
    public static final String ROOT_META_PREFIX = "root::";
    public static final String ROOT_META_VALUE = "indexed";
    public static final String LAST_INDEX_TIME_KEY = "last_index_time";

    // ==================== 存储 ====================
    public static final String DEFAULT_CATALOG_FILE = "file_index.db";
}
