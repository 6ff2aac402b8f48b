/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.dataprep.di.module;

import java.util.ArrayList;
import java.util.List;

import ml.shifu.dataprep.container.obj.Column;
import ml.shifu.dataprep.container.obj.MissingValueStrategy;
import ml.shifu.dataprep.container.obj.ProcessingConfig;
import ml.shifu.dataprep.container.obj.Table;
import ml.shifu.dataprep.di.builtin.MissingValueHandler;
import ml.shifu.dataprep.di.service.TransformationService;
import ml.shifu.dataprep.di.spi.OutlierDetector;
import ml.shifu.dataprep.di.spi.Transformation;
import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.DataPrepException;
import ml.shifu.dataprep.util.Constants;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.inject.Guice;
import com.google.inject.Injector;

/**
 * CleansingModuleTest class
 */
public class CleansingModuleTest {

    @Test
    public void testDefaultBinding() {
        Injector injector = Guice.createInjector(new CleansingModule(new ProcessingConfig("median")));
        TransformationService service = injector.getInstance(TransformationService.class);

        List<String> names = new ArrayList<String>();
        for(Transformation transformation: service.getTransformations()) {
            names.add(transformation.getName());
        }
        Assert.assertEquals(names.size(), 3);
        Assert.assertEquals(names.get(0), Constants.STAGE_DEDUPLICATE);
        Assert.assertEquals(names.get(1), Constants.STAGE_REMOVE_OUTLIERS);
        Assert.assertEquals(names.get(2), Constants.STAGE_HANDLE_MISSING_VALUES);

        MissingValueHandler handler = (MissingValueHandler) service.getTransformations().get(2);
        Assert.assertEquals(handler.getStrategy(), MissingValueStrategy.MEDIAN);
    }

    @Test
    public void testMockOutlierDetector() {
        CleansingModule module = new CleansingModule(new ProcessingConfig());
        module.setOutlierDetectorImplClass(NoOutlierDetector.class);
        TransformationService service = Guice.createInjector(module).getInstance(TransformationService.class);

        Table table = Table.of(Column.ofDoubles("v", 1d, 2d, 3d, 4d, 5d, 6d, 7d, 8d, 9d, 100d));
        Assert.assertEquals(service.exec(table).getLeft().getRowCount(), 10);
    }

    @Test
    public void testOutlierDetectorByName() {
        CleansingModule module = new CleansingModule(new ProcessingConfig());
        module.setOutlierDetectorImplClass(NoOutlierDetector.class.getName());
        TransformationService service = Guice.createInjector(module).getInstance(TransformationService.class);

        Table table = Table.of(Column.ofDoubles("v", 1d, 2d, 3d, 4d, 5d, 6d, 7d, 8d, 9d, 100d));
        Assert.assertEquals(service.exec(table).getLeft().getRowCount(), 10);
    }

    @Test
    public void testBindUnknownClass() {
        CleansingModule module = new CleansingModule(new ProcessingConfig());
        try {
            module.setOutlierDetectorImplClass("ml.shifu.dataprep.NoSuchDetector");
            Assert.fail();
        } catch (DataPrepException e) {
            Assert.assertEquals(e.getError(), DataPrepErrorCode.ERROR_BINDING_CLASS);
        }
        try {
            module.setOutlierDetectorImplClass(String.class.getName());
            Assert.fail();
        } catch (DataPrepException e) {
            Assert.assertEquals(e.getError(), DataPrepErrorCode.ERROR_BINDING_CLASS);
        }
    }

    public static class NoOutlierDetector implements OutlierDetector {
        @Override
        public boolean[] detect(Column column) {
            return new boolean[column.size()];
        }
    }

}
