package com.yizhaoqi.filevault.repository;

import com.yizhaoqi.filevault.model.FileDocument;
import com.yizhaoqi.filevault.model.FileType;
import com.yizhaoqi.filevault.model.ParentRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;


@DataJpaTest
@ActiveProfiles("test")
class FileDocumentRepositoryTest {

    @Autowired
    private FileDocumentRepository fileDocumentRepository;

    private final List<Long> rootIds = new ArrayList<>();

    @BeforeEach
    void setUp() {
        for (int i = 0; i < 25; i++) {
            rootIds.add(fileDocumentRepository.save(document(1L, "file" + i, ParentRef.ROOT)).getId());
        }
        FileDocument folder = fileDocumentRepository.save(document(1L, "folder", ParentRef.ROOT));
        rootIds.add(folder.getId());
        fileDocumentRepository.save(document(1L, "nested", ParentRef.folder(folder.getId())));
        fileDocumentRepository.save(document(2L, "someone else", ParentRef.ROOT));
    }

    private FileDocument document(Long ownerId, String name, ParentRef parent) {
        FileDocument file = new FileDocument();
        file.setUserId(ownerId);
        file.setName(name);
        file.setType(name.equals("folder") ? FileType.FOLDER : FileType.FILE);
        file.setParent(parent);
        return file;
    }

    private List<FileDocument> page(int page) {
        return fileDocumentRepository.findByUserIdAndParentId(1L, FileDocument.ROOT_PARENT_ID,
                PageRequest.of(page, 20, Sort.by(Sort.Direction.DESC, "id")));
    }

    @Test
    void testPaging_NewestFirstWithoutOverlap() {
        List<FileDocument> first = page(0);
        List<FileDocument> second = page(1);

        assertEquals(20, first.size());
        assertEquals(6, second.size());
        assertTrue(page(2).isEmpty());

        List<Long> ids = new ArrayList<>();
        first.forEach(file -> ids.add(file.getId()));
        second.forEach(file -> ids.add(file.getId()));

        List<Long> expected = new ArrayList<>(rootIds);
        expected.sort((a, b) -> Long.compare(b, a));
        assertEquals(expected, ids);

        Set<Long> unique = new HashSet<>(ids);
        assertEquals(26, unique.size());
    }

    @Test
    void testPaging_IsStableAcrossCalls() {
        List<Long> once = page(0).stream().map(FileDocument::getId).toList();
        List<Long> again = page(0).stream().map(FileDocument::getId).toList();

        assertEquals(once, again);
    }

    @Test
    void testFindByIdAndUserId_ScopesToOwner() {
        Long id = rootIds.get(0);

        assertTrue(fileDocumentRepository.findByIdAndUserId(id, 1L).isPresent());
        assertTrue(fileDocumentRepository.findByIdAndUserId(id, 2L).isEmpty());
    }

    @Test
    void testChildrenAreListedUnderTheirFolder() {
        Long folderId = rootIds.get(rootIds.size() - 1);

        List<FileDocument> children = fileDocumentRepository.findByUserIdAndParentId(1L, folderId,
                PageRequest.of(0, 20, Sort.by(Sort.Direction.DESC, "id")));

        assertEquals(1, children.size());
        assertEquals("nested", children.get(0).getName());
        assertEquals(ParentRef.folder(folderId), children.get(0).getParent());
    }
}
