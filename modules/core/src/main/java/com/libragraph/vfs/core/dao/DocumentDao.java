package com.libragraph.vfs.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(DocumentRecord.class)
public interface DocumentDao {

    @SqlUpdate("CREATE TABLE IF NOT EXISTS vfs_document (" +
            "id TEXT PRIMARY KEY, " +
            "doctype TEXT NOT NULL, " +
            "rev TEXT NOT NULL, " +
            "body JSONB NOT NULL)")
    void createTable();

    @SqlUpdate("CREATE INDEX IF NOT EXISTS vfs_document_path_idx " +
            "ON vfs_document (doctype, (body ->> 'path') text_pattern_ops)")
    void createPathIndex();

    @SqlUpdate("CREATE INDEX IF NOT EXISTS vfs_document_folder_idx " +
            "ON vfs_document (doctype, (body ->> 'folder_id'))")
    void createFolderIndex();

    @SqlUpdate("INSERT INTO vfs_document (id, doctype, rev, body) " +
            "VALUES (:id, :doctype, :rev, CAST(:body AS jsonb))")
    void insert(@Bind("id") String id,
                @Bind("doctype") String doctype,
                @Bind("rev") String rev,
                @Bind("body") String body);

    @SqlQuery("SELECT id, doctype, rev, body::text AS body FROM vfs_document " +
            "WHERE doctype = :doctype AND id = :id")
    Optional<DocumentRecord> findById(@Bind("doctype") String doctype, @Bind("id") String id);

    /**
     * Replaces the body only if the stored revision still equals {@code rev}.
     *
     * @return number of rows updated: 1 on success, 0 on revision mismatch or missing id
     */
    @SqlUpdate("UPDATE vfs_document SET rev = :newRev, body = CAST(:body AS jsonb) " +
            "WHERE doctype = :doctype AND id = :id AND rev = :rev")
    int compareAndSet(@Bind("doctype") String doctype,
                      @Bind("id") String id,
                      @Bind("rev") String rev,
                      @Bind("newRev") String newRev,
                      @Bind("body") String body);

    @SqlQuery("SELECT id, doctype, rev, body::text AS body FROM vfs_document " +
            "WHERE doctype = :doctype AND body ->> CAST(:field AS text) = :value " +
            "LIMIT :limit")
    List<DocumentRecord> findEqual(@Bind("doctype") String doctype,
                                   @Bind("field") String field,
                                   @Bind("value") String value,
                                   @Bind("limit") long limit);

    @SqlQuery("SELECT id, doctype, rev, body::text AS body FROM vfs_document " +
            "WHERE doctype = :doctype AND starts_with(body ->> CAST(:field AS text), :prefix) " +
            "LIMIT :limit")
    List<DocumentRecord> findPrefix(@Bind("doctype") String doctype,
                                    @Bind("field") String field,
                                    @Bind("prefix") String prefix,
                                    @Bind("limit") long limit);
}
